package org.cnext.compiler.frontend.semantics.flow;

import org.cnext.compiler.CompilationFixture;
import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests definite initialization of locals across branches, loops and out-parameters.
 */
public class InitializationRuleTest {

    @Test
    @Tag("unit")
    void assignedOnBothBranchesIsInitialized() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                u32 pick(bool fast) {
                    u32 delay;
                    if (fast) {
                        delay <- 1;
                    } else {
                        delay <- 10;
                    }
                    return delay;
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
    }

    @Test
    @Tag("unit")
    void assignedOnOneBranchIsReportedOnce() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                u32 pick(bool fast) {
                    u32 delay;
                    if (fast) {
                        delay <- 1;
                    }
                    u32 twice <- delay + delay;
                    return twice;
                }
                """);

        assertThat(fixture.diagnostics().getDiagnostics())
                .filteredOn(d -> d.code() == DiagnosticCode.USE_BEFORE_INIT)
                .hasSize(1);
        assertThat(fixture.diagnostics().summary()).contains("'delay'");
    }

    @Test
    @Tag("unit")
    void loopBodyMayNotRun() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                u8 scan(u8 limit) {
                    u8 last;
                    u8 i <- 0;
                    while (i < limit) {
                        last <- i;
                        i +<- 1;
                    }
                    return last;
                }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.USE_BEFORE_INIT)).isTrue();
    }

    @Test
    @Tag("unit")
    void readInsideNestedLoopsIsReportedOnce() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                u32 sum(u32 rows) {
                    u32 total;
                    for (u32 r <- 0; r < rows; r +<- 1) {
                        u32 c <- 0;
                        while (c < 4) {
                            total +<- c;
                            c +<- 1;
                        }
                    }
                    return 0;
                }
                """);

        assertThat(fixture.diagnostics().getDiagnostics())
                .filteredOn(d -> d.code() == DiagnosticCode.USE_BEFORE_INIT)
                .hasSize(1);
    }

    @Test
    @Tag("unit")
    void outParameterInitializes() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                void load(u32 target) {
                    target <- 42;
                }

                u32 fetch() {
                    u32 value;
                    load(value);
                    return value;
                }
                """);

        assertThat(fixture.diagnostics().hasErrors()).as(fixture.diagnostics().summary()).isFalse();
    }

    @Test
    @Tag("unit")
    void codeAfterReturnIsNotAnalyzed() {
        CompilationFixture fixture = new CompilationFixture();
        fixture.compile("""
                u32 early() {
                    u32 value;
                    return 1;
                    return value;
                }
                """);

        assertThat(fixture.diagnostics().hasCode(DiagnosticCode.USE_BEFORE_INIT)).isFalse();
    }
}
