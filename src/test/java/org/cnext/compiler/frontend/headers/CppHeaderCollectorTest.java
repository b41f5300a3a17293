package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the C++ extensions of the header grammar.
 */
public class CppHeaderCollectorTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final SymbolTable table = new SymbolTable(diagnostics);

    private void collect(String content) {
        DependencyNode node = new DependencyNode("/src/hal.hpp", SourceLanguage.CPP, content, 1L,
                List.of(), List.of(), false);
        new CppHeaderCollector().collect(node, table, diagnostics);
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
    }

    @Test
    @Tag("unit")
    void namespaceMembersAreQualified() {
        collect("""
                namespace hal {
                namespace gpio {
                    void toggle(int pin);
                }
                    int version();
                }
                """);

        assertThat(table.resolveFunction("hal::gpio::toggle")).isPresent();
        assertThat(table.resolveFunction("hal::version")).isPresent();
        assertThat(table.contains("toggle")).isFalse();
    }

    @Test
    @Tag("unit")
    void overloadsAreKeptSideBySide() {
        collect("""
                void log(int value);
                void log(const char* text);
                """);

        assertThat(table.resolveAll("log")).hasSize(2)
                .allMatch(Symbol.FunctionSymbol.class::isInstance);
    }

    @Test
    @Tag("unit")
    void classesExposeOnlyPublicFields() {
        collect("""
                class Timer {
                    int secret;
                public:
                    Timer();
                    ~Timer();
                    unsigned int period;
                    void start();
                private:
                    int ticks;
                };
                """);

        assertThat(table.resolveType("Timer").orElseThrow().structFields()).containsOnlyKeys("period");
    }

    @Test
    @Tag("unit")
    void scopedEnumsAndAliases() {
        collect("""
                enum class Mode : unsigned char { Idle, Run = 3 };
                using Counter = unsigned long;
                template <typename T> T clamp(T v, T lo, T hi);
                """);

        Symbol.EnumSymbol mode = table.resolveEnum("Mode").orElseThrow();
        assertThat(mode.type().bitWidth()).isEqualTo(8);
        assertThat(mode.members()).containsEntry("Run", 3L);
        assertThat(table.resolve("Counter")).isPresent();
        assertThat(table.contains("clamp")).isFalse();
    }
}
