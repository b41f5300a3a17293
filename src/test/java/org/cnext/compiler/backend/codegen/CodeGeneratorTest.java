package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.CompilationFixture;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the C text generated for declarations, functions and statements.
 */
public class CodeGeneratorTest {

    @Test
    @Tag("unit")
    void mainReturnsIntAndGetsImplicitReturn() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("void main() { u32 x <- 5; }");

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).startsWith("#include \"test.h\"\n");
        assertThat(unit.source()).contains("int main(void) {", "    uint32_t x = 5U;", "    return 0;");
        assertThat(unit.header()).doesNotContain("main");
    }

    @Test
    @Tag("unit")
    void mutatedScalarParameterIsPassedByPointer() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("""
                void increment(u32 value) { value +<- 1; }
                void main() { u32 x <- 0; increment(x); }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("void increment(uint32_t* value) {", "(*value) += 1U;", "increment(&x);");
        assertThat(unit.header()).contains("void increment(uint32_t* value);");
    }

    @Test
    @Tag("unit")
    void unmodifiedParameterIsConstInDefinitionAndPrototype() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("u32 twice(u32 value) { return value * 2; }");

        assertThat(unit.source()).contains("uint32_t twice(const uint32_t value) {");
        assertThat(unit.header()).contains("uint32_t twice(const uint32_t value);");
    }

    @Test
    @Tag("unit")
    void enumsAndStructsBecomeTypedefs() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("""
                enum Mode { IDLE, RUN <- 5, STOP }
                struct Point { i32 x; i32 y; }
                Mode current <- Mode.RUN;
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.header()).contains("Mode_IDLE = 0,", "Mode_RUN = 5,", "Mode_STOP = 6", "} Mode;",
                "typedef struct Point {", "    int32_t x;", "} Point;", "extern Mode current;");
        assertThat(unit.source()).contains("Mode current = Mode_RUN;");
    }

    @Test
    @Tag("unit")
    void privateScopeMembersAreStaticAndKeptOutOfTheHeader() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("""
                scope Motor {
                    u8 speed <- 0;
                    public void set(u8 value) { this.speed <- value; }
                    void reset() { this.speed <- 0; }
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("static uint8_t Motor_speed = 0U;", "static void Motor_reset(void) {",
                "void Motor_set(const uint8_t value) {");
        assertThat(unit.header()).contains("void Motor_set(const uint8_t value);")
                .doesNotContain("Motor_reset", "Motor_speed");
    }

    @Test
    @Tag("unit")
    void publicConstGlobalIsExportedAsExternConst() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("const u16 LIMIT <- 500;");

        assertThat(unit.source()).contains("const uint16_t LIMIT = 500U;");
        assertThat(unit.header()).contains("extern const uint16_t LIMIT;");
    }

    @Test
    @Tag("unit")
    void stringsAreBoundedAndCopiedSafely() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("""
                void main() {
                    string<8> name <- "motor";
                    name <- "fan";
                    u32 n <- name.length;
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("#include <string.h>", "char name[9] = \"motor\";",
                "strncpy(name, \"fan\", 8);", "name[8] = '\\0';", "strlen(name)");
    }

    @Test
    @Tag("unit")
    void stringLiteralLongerThanCapacityIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("void main() { string<3> s <- \"toolong\"; }");

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.LITERAL_OUT_OF_RANGE)).isTrue();
    }

    @Test
    @Tag("unit")
    void bitIndexWritesUseReadModifyWrite() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("""
                void main() {
                    u8 flags <- 0;
                    flags[3] <- 1;
                    u8 low <- flags[0, 4];
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("flags = (flags & ~(1U << 3)) | (((uint8_t)(1) & 1U) << 3);",
                "((flags >> 0) & 0xFU)");
    }

    @Test
    @Tag("unit")
    void bitIndexBeyondWidthIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("void main() { u8 flags <- 0; flags[8] <- 1; }");

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.BIT_INDEX_OUT_OF_RANGE)).isTrue();
    }

    @Test
    @Tag("unit")
    void useBeforeDefinitionIsDistinguishedFromUndefined() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void main() { later(); missing(); }
                void later() { }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.USE_BEFORE_DEFINITION)).isTrue();
        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.UNDEFINED_IDENTIFIER)).isTrue();
    }

    @Test
    @Tag("unit")
    void argumentCountIsChecked() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void set(u8 value) { }
                void main() { set(1, 2); }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.ARGUMENT_COUNT_MISMATCH)).isTrue();
    }

    @Test
    @Tag("unit")
    void cNextIncludeBecomesHeaderInclude() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("#include \"motor.cnx\"\nvoid main() { }");

        assertThat(unit.header()).contains("#include \"motor.h\"");
    }

    @Test
    @Tag("unit")
    void foreignStructFieldLengthIsItsBitWidth() {
        CompilationFixture fixture = new CompilationFixture()
                .withHeader("/src/sensor.h", "typedef struct { uint32_t raw; uint8_t flags; } Sensor;");
        GeneratedUnit unit = fixture.compile("""
                void main() {
                    Sensor s;
                    u32 bits <- s.raw.length;
                    u8 total <- s.flags.length;
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("uint32_t bits = 32;", "uint8_t total = 8;");
    }

    @Test
    @Tag("unit")
    void foreignTypedefNamesAreNotSpelledAsTags() {
        CompilationFixture fixture = new CompilationFixture()
                .withHeader("/src/types.h", """
                        #include <stdint.h>
                        typedef enum { M_A, M_B, M_C } Mode;
                        typedef enum level_tag { LEVEL_LOW, LEVEL_HIGH } Level;
                        typedef struct { uint32_t raw; uint8_t tag[4]; } Sensor;
                        struct Point { int32_t x; int32_t y; };
                        """);
        GeneratedUnit unit = fixture.compile("""
                void configure(Mode m, Level l) {
                    Sensor s;
                    Point p;
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("const Mode m", "const Level l", "Sensor s = {0};",
                "struct Point p = {0};");
        assertThat(unit.source()).doesNotContain("enum Mode", "enum Level", "struct Sensor");
    }

    @Test
    @Tag("unit")
    void typeBoundsUseStdintMacros() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("void main() { i32 low <- i32.MIN; u8 high <- u8.MAX; }");

        assertThat(unit.source()).contains("int32_t low = INT32_MIN;", "uint8_t high = UINT8_MAX;");
    }
}
