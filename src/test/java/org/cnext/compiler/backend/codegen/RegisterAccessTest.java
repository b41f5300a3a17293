package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.CompilationFixture;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests register macros and the access-mode rules for register fields.
 */
public class RegisterAccessTest {

    private static final String GPIO = """
            register GPIO @ 0x40000000 {
                DR: u32 rw @ 0x00,
                IDR: u32 ro @ 0x04,
                ICR: u32 w1c @ 0x08,
                BSR: u32 wo @ 0x0C,
            }

            """;

    private GeneratedUnit compile(CompilationFixture fixture, String body) {
        return fixture.compile(GPIO + "void main() {\n" + body + "\n}\n");
    }

    @Test
    @Tag("unit")
    void fieldsBecomeVolatileMacros() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = compile(fixture, """
                u32 level <- GPIO.IDR;
                GPIO.DR <- level;
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.header()).contains("#define GPIO_DR (*(volatile uint32_t*)(0x40000000 + ",
                "#define GPIO_ICR (*(volatile uint32_t*)(0x40000000 + ");
        assertThat(unit.source()).contains("uint32_t level = GPIO_IDR;", "GPIO_DR = level;");
    }

    @Test
    @Tag("unit")
    void bitWriteOnReadWriteFieldIsReadModifyWrite() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = compile(fixture, "GPIO.DR[5] <- true;");

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("GPIO_DR = (GPIO_DR & ~(");
    }

    @Test
    @Tag("unit")
    void singleBitWriteOnClearFieldIsPlainWrite() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = compile(fixture, "GPIO.ICR[3] <- 1;");

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("GPIO_ICR = (((uint32_t)(");
        assertThat(unit.source()).doesNotContain("GPIO_ICR & ~");
    }

    @Test
    @Tag("unit")
    void fullZeroWriteOnClearFieldIsAccepted() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = compile(fixture, "GPIO.ICR <- 0;");

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("GPIO_ICR = 0U;");
    }

    @Test
    @Tag("unit")
    void bitRangeWriteOnClearFieldIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        compile(fixture, "GPIO.ICR[0, 4] <- 15;");

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.BIT_RANGE_WRITE_ON_W1)).isTrue();
    }

    @Test
    @Tag("unit")
    void readingWriteOnlyFieldIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        compile(fixture, "u32 copy <- GPIO.BSR;");

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.READ_OF_WRITE_ONLY_REGISTER)).isTrue();
    }

    @Test
    @Tag("unit")
    void compoundWriteToWriteOnlyFieldIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        compile(fixture, "GPIO.BSR |<- 1;");

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.READ_OF_WRITE_ONLY_REGISTER)).isTrue();
    }

    @Test
    @Tag("unit")
    void writingReadOnlyFieldIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        compile(fixture, "GPIO.IDR <- 1;");

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.WRITE_TO_READ_ONLY_REGISTER)).isTrue();
    }

    @Test
    @Tag("unit")
    void zeroBitWriteOnWriteOnlyFieldIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        compile(fixture, "GPIO.BSR[2] <- 0;");

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.CLEARING_WRITE_ON_WRITE_ONLY)).isTrue();
    }
}
