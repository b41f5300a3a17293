package org.cnext.compiler.frontend.semantics.analysis;

import org.cnext.compiler.CompilationFixture;
import org.cnext.compiler.backend.codegen.GeneratedUnit;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests parameter mutation tracking, its propagation through calls, and explicit const checks.
 */
public class ModificationAnalyzerTest {

    @Test
    @Tag("unit")
    void mutationPropagatesThroughEarlierCallee() {
        CompilationFixture fixture = new CompilationFixture();
        GeneratedUnit unit = fixture.compile("""
                void bump(u32 value) {
                    value +<- 1;
                }

                void twice(u32 counter) {
                    bump(counter);
                    bump(counter);
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
        assertThat(unit.source()).contains("void bump(uint32_t* value) {", "void twice(uint32_t* counter) {");
        assertThat(unit.header()).contains("void bump(uint32_t* value);", "void twice(uint32_t* counter);");
        assertThat(fixture.context().getSignatures().isParameterMutated("twice", 0)).isTrue();
    }

    @Test
    @Tag("unit")
    void readOnlyParameterIsAutoConst() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                u32 square(u32 n) {
                    return n * n;
                }
                """);

        assertThat(fixture.context().getSignatures().modes("square")).hasValueSatisfying(modes -> {
            assertThat(modes).hasSize(1);
            assertThat(modes.get(0).isAutoConst()).isTrue();
            assertThat(modes.get(0).mutated()).isFalse();
        });
    }

    @Test
    @Tag("unit")
    void assignmentToConstLocalIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void main() {
                    const u8 limit <- 3;
                    limit <- 4;
                }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.ASSIGNMENT_TO_CONST)).isTrue();
        assertThat(fixture.diagnostics().summary()).contains("Remove 'const' from the declaration of 'limit'");
    }

    @Test
    @Tag("unit")
    void constnessFollowsTheEnclosingBlock() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void configure(bool fast) {
                    if (fast) {
                        const u8 limit <- 3;
                        u8 copy <- limit;
                    } else {
                        u8 limit <- 5;
                        limit <- 6;
                    }
                }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.ASSIGNMENT_TO_CONST))
                .as(fixture.diagnostics().summary())
                .isFalse();
    }

    @Test
    @Tag("unit")
    void constLocalInLaterBlockIsStillRejected() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void configure(bool fast) {
                    if (fast) {
                        u8 limit <- 5;
                        limit <- 6;
                    } else {
                        const u8 limit <- 3;
                        limit <- 4;
                    }
                }
                """);

        assertThat(fixture.diagnostics().getDiagnostics())
                .filteredOn(d -> d.code() == DiagnosticCode.ASSIGNMENT_TO_CONST)
                .hasSize(1);
    }

    @Test
    @Tag("unit")
    void assignmentToConstParameterIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void clamp(const u8 level) {
                    level <- 0;
                }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.ASSIGNMENT_TO_CONST)).isTrue();
    }

    @Test
    @Tag("unit")
    void constPassedToMutatingCalleeIsRejected() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                const u32 SEED <- 7;

                void bump(u32 value) {
                    value +<- 1;
                }

                void main() {
                    bump(SEED);
                }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.CONST_PASSED_AS_MUTABLE)).isTrue();
        assertThat(fixture.diagnostics().summary()).contains("'bump'");
    }
}
