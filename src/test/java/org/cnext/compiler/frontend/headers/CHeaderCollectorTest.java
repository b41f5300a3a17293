package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolKind;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests symbol extraction from C headers.
 */
public class CHeaderCollectorTest {

    private DiagnosticsEngine diagnostics;
    private SymbolTable table;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        table = new SymbolTable(diagnostics);
    }

    private List<Symbol> collect(String content) {
        DependencyNode node = new DependencyNode("/src/board.h", SourceLanguage.C, content, 1L,
                List.of(), List.of(), false);
        return new CHeaderCollector().collect(node, table, diagnostics);
    }

    @Test
    @Tag("unit")
    void structFieldsKeepTheirWidths() {
        collect("""
                #include <stdint.h>
                typedef struct {
                    uint32_t id;
                    uint8_t flags : 3;
                    int16_t samples[4];
                } Sensor;
                """);

        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        TypeInfo sensor = table.resolveType("Sensor").orElseThrow();
        assertThat(sensor.structFields()).containsOnlyKeys("id", "flags", "samples");
        assertThat(sensor.structFields().get("id").bitWidth()).isEqualTo(32);
        assertThat(sensor.structFields().get("flags").bitWidth()).isEqualTo(3);
        assertThat(sensor.structFields().get("samples").arrayDimensions()).containsExactly(4);
    }

    @Test
    @Tag("unit")
    void scalarMacrosAreConstantsAndFunctionLikeMacrosAreSkipped() {
        List<Symbol> symbols = collect("""
                #define BUFFER_SIZE 64
                #define MASK 0xFFu
                #define RATIO 0.5f
                #define MAX(a, b) ((a) > (b) ? (a) : (b))
                #define NAME "board"
                """);

        assertThat(symbols).extracting(Symbol::name).containsExactly("BUFFER_SIZE", "MASK", "RATIO");
        assertThat(symbols).allMatch(s -> s.kind() == SymbolKind.MACRO_CONSTANT);
        assertThat(symbols.get(1).type().kind()).isEqualTo(TypeKind.UNSIGNED);
        assertThat(symbols.get(2).type().kind()).isEqualTo(TypeKind.FLOAT);
    }

    @Test
    @Tag("unit")
    void enumValuesContinueFromExplicitInitializers() {
        collect("typedef enum { LED_OFF, LED_ON = 4, LED_BLINK } LedState;");

        Symbol.EnumSymbol led = table.resolveEnum("LedState").orElseThrow();
        assertThat(led.members()).containsExactly(
                entry("LED_OFF", 0L),
                entry("LED_ON", 4L),
                entry("LED_BLINK", 5L));
        assertThat(table.resolveEnumMemberOwner("LED_BLINK")).isPresent();
    }

    @Test
    @Tag("unit")
    void prototypesAndGlobalsAreCollected() {
        collect("""
                extern volatile uint32_t tick_count;
                void uart_write(const char* data, size_t length);
                int printf_like(const char* format, ...);
                static int hidden;
                static inline int twice(int v) { return v * 2; }
                """);

        Symbol.FunctionSymbol write = table.resolveFunction("uart_write").orElseThrow();
        assertThat(write.isDeclaration()).isTrue();
        assertThat(write.parameters()).hasSize(2);
        assertThat(table.resolveFunction("printf_like").orElseThrow().variadic()).isTrue();
        assertThat(table.resolveFunction("twice").orElseThrow().isDeclaration()).isFalse();
        assertThat(table.resolve("tick_count")).hasValueSatisfying(s ->
                assertThat(((Symbol.VariableSymbol) s).isExtern()).isTrue());
        assertThat(table.contains("hidden")).isFalse();
    }

    @Test
    @Tag("unit")
    void conditionalCompilationLinesAreIgnored() {
        collect("""
                #ifndef BOARD_H
                #define BOARD_H
                #ifdef __cplusplus
                extern "C" {
                #endif
                void board_init(void);
                #ifdef __cplusplus
                }
                #endif
                #endif
                """);

        assertThat(table.resolveFunction("board_init")).isPresent();
    }

    @Test
    @Tag("unit")
    void malformedDeclarationReportsAndRecovers() {
        collect("""
                struct Broken { int a
                void after(void);
                """);

        assertThat(diagnostics.hasCode(DiagnosticCode.HEADER_PARSE_ERROR)).isTrue();
        assertThat(diagnostics.summary()).contains("board.h");
    }
}
