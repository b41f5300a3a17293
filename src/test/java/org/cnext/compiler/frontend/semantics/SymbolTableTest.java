package org.cnext.compiler.frontend.semantics;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the conflict policy of the unified symbol table.
 */
public class SymbolTableTest {

    private static final TypeInfo INT = BuiltinTypes.cScalar("int").orElseThrow();

    private DiagnosticsEngine diagnostics;
    private SymbolTable table;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        table = new SymbolTable(diagnostics);
    }

    private static Symbol.FunctionSymbol function(String name, SourceLanguage language, boolean declaration,
                                                  TypeInfo... parameterTypes) {
        List<Symbol.Parameter> parameters = Arrays.stream(parameterTypes)
                .map(t -> new Symbol.Parameter("p", t, false))
                .toList();
        return new Symbol.FunctionSymbol(name, new SymbolOrigin(language.name().toLowerCase() + ".src", 3, language),
                TypeInfo.voidType(), parameters, declaration, false);
    }

    @Test
    @Tag("unit")
    void crossLanguageDefinitionIsRejected() {
        assertThat(table.define(function("init", SourceLanguage.C, false))).isTrue();
        assertThat(table.define(function("init", SourceLanguage.CNEXT, false))).isFalse();

        assertThat(diagnostics.hasCode(DiagnosticCode.CROSS_LANGUAGE_CONFLICT)).isTrue();
        assertThat(diagnostics.summary()).contains("Rename the C-Next symbol 'init'");
        assertThat(table.resolveAll("init")).hasSize(1);
    }

    @Test
    @Tag("unit")
    void duplicateWithinOneLanguageIsRejected() {
        table.define(function("tick", SourceLanguage.CNEXT, false));
        table.define(function("tick", SourceLanguage.CNEXT, false, INT));

        assertThat(diagnostics.hasCode(DiagnosticCode.DUPLICATE_DEFINITION)).isTrue();
    }

    @Test
    @Tag("unit")
    void repeatedPrototypesAndCppOverloadsAreAccepted() {
        assertThat(table.define(function("reset", SourceLanguage.C, true, INT))).isTrue();
        assertThat(table.define(function("reset", SourceLanguage.CPP, true, INT))).isTrue();
        assertThat(table.define(function("print", SourceLanguage.CPP, true, INT))).isTrue();
        assertThat(table.define(function("print", SourceLanguage.CPP, true, TypeInfo.string(8)))).isTrue();

        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        assertThat(table.resolveAll("print")).hasSize(2);
    }

    @Test
    @Tag("unit")
    void identicalSymbolIsIdempotent() {
        Symbol.FunctionSymbol symbol = function("main", SourceLanguage.CNEXT, false);
        table.define(symbol);
        table.define(symbol);

        assertThat(table.size()).isEqualTo(1);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void typedefChainsResolveToTheStruct() {
        SymbolOrigin origin = new SymbolOrigin("board.h", 1, SourceLanguage.C);
        TypeInfo point = TypeInfo.struct("Point", Map.of("x", INT));
        table.define(new Symbol.StructSymbol("Point", origin, point));
        table.define(new Symbol.TypedefSymbol("Point", origin, TypeInfo.scalar("Point", TypeKind.STRUCT, 0)));
        table.define(new Symbol.TypedefSymbol("Coord", origin, TypeInfo.scalar("struct Point", TypeKind.STRUCT, 0)));

        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        assertThat(table.resolveType("Coord")).hasValueSatisfying(t ->
                assertThat(t.structFields()).containsKey("x"));
        assertThat(table.resolveType("u16")).hasValueSatisfying(t -> assertThat(t.bitWidth()).isEqualTo(16));
        assertThat(table.resolveType("Nope")).isEmpty();
    }

    @Test
    @Tag("unit")
    void foreignEnumeratorsKnowTheirOwner() {
        SymbolOrigin origin = new SymbolOrigin("mode.h", 2, SourceLanguage.C);
        table.define(new Symbol.EnumSymbol("Mode", origin, TypeInfo.scalar("Mode", TypeKind.ENUM, 32),
                Map.of("MODE_IDLE", 0L)));

        assertThat(table.resolveEnumMemberOwner("MODE_IDLE")).hasValueSatisfying(e ->
                assertThat(e.name()).isEqualTo("Mode"));
        assertThat(table.resolveEnumMemberOwner("MODE_RUN")).isEmpty();
    }
}
