package org.cnext.compiler.backend.codegen;

import org.cnext.compiler.CompilationFixture;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests emission of loops, branches and byte range writes.
 */
public class StatementGeneratorTest {

    @Test
    @Tag("unit")
    void loopsAndBranches() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("""
                u32 spin(u32 limit) {
                    u32 total <- 0;
                    for (u32 i <- 0; i < 4; i +<- 1) {
                        total +<- i;
                    }
                    do {
                        total +<- 2;
                    } while (total < limit);
                    if (total > 100) {
                        total <- 100;
                    } else if (total = 0) {
                        total <- 1;
                    } else {
                        total -<- 1;
                    }
                    return total;
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains(
                "for (uint32_t i = 0U; i < 4U; i += 1U) {",
                "do {",
                "} while (total < limit);",
                "} else if (total == 0U) {",
                "} else {",
                "total -= 1U;");
    }

    @Test
    @Tag("unit")
    void byteRangeWriteBecomesMemcpy() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("""
                void pack(u32 word) {
                    u8 frame[8];
                    frame[2, 4] <- word;
                    u8 size <- frame.length;
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("#include <string.h>", "memcpy((uint8_t*)frame + 2, &word, 4);",
                "uint8_t size = 8;");
    }

    @Test
    @Tag("unit")
    void byteRangeWritePastTheEndIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void pack(u32 word) {
                    u8 frame[8];
                    frame[6, 4] <- word;
                }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.SLICE_OUT_OF_BOUNDS)).isTrue();
    }

    @Test
    @Tag("unit")
    void byteRangeWriteNeedsConstantBounds() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void pack(u32 word, u8 at) {
                    u8 frame[8];
                    frame[at, 4] <- word;
                }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.SLICE_NOT_CONSTANT)).isTrue();
    }
}
