package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.module.DependencyGraph;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolOrigin;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.TypeInfo;
import org.cnext.compiler.frontend.semantics.TypeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests how header symbols are taken from the cache, the collectors and the system catalog.
 */
@ExtendWith(MockitoExtension.class)
public class SymbolCollectionPhaseTest {

    private static final String HEADER = "/work/board.h";

    private DiagnosticsEngine diagnostics;
    private SymbolTable symbolTable;
    @Mock
    private IHeaderCollector collector;
    @Mock
    private HeaderSymbolCache cache;
    private SymbolCollectionPhase phase;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        symbolTable = new SymbolTable(diagnostics);
        HeaderCollectorRegistry registry = new HeaderCollectorRegistry();
        registry.register(SourceLanguage.C, collector);
        phase = new SymbolCollectionPhase(symbolTable, diagnostics, registry, cache);
    }

    private static DependencyNode header() {
        return new DependencyNode(HEADER, SourceLanguage.C, "int board_id;\n", 42L, List.of(), List.of(), false);
    }

    private static Symbol boardId() {
        return new Symbol.VariableSymbol("board_id", new SymbolOrigin(HEADER, 1, SourceLanguage.C),
                TypeInfo.scalar("int", TypeKind.SIGNED, 32), true);
    }

    private static DependencyGraph graphOf(DependencyNode... nodes) {
        return new DependencyGraph(nodes[nodes.length - 1], List.of(nodes));
    }

    @Test
    @Tag("unit")
    void cacheHitSkipsCollector() {
        when(cache.cachedSymbols(HEADER, 42L)).thenReturn(Optional.of(List.of(boardId())));

        boolean ok = phase.collect(graphOf(header()));

        assertThat(ok).isTrue();
        assertThat(symbolTable.resolve("board_id")).isPresent();
        verify(collector, never()).collect(any(), any(), any());
        verify(cache, never()).store(any(), any());
    }

    @Test
    @Tag("unit")
    void cacheMissCollectsAndStores() {
        DependencyNode node = header();
        when(cache.cachedSymbols(anyString(), anyLong())).thenReturn(Optional.empty());
        when(collector.collect(node, symbolTable, diagnostics)).thenReturn(List.of(boardId()));

        boolean ok = phase.collect(graphOf(node));

        assertThat(ok).isTrue();
        verify(collector).collect(node, symbolTable, diagnostics);
        verify(cache).store(node, List.of(boardId()));
    }

    @Test
    @Tag("unit")
    void failedHeaderIsNotCached() {
        DependencyNode node = header();
        when(cache.cachedSymbols(anyString(), anyLong())).thenReturn(Optional.empty());
        when(collector.collect(node, symbolTable, diagnostics)).thenAnswer(invocation -> {
            diagnostics.reportError(DiagnosticCode.HEADER_PARSE_ERROR, "Unexpected '}'", HEADER, 3, 1);
            return List.of();
        });

        boolean ok = phase.collect(graphOf(node));

        assertThat(ok).isFalse();
        verify(cache, never()).store(any(), any());
    }

    @Test
    @Tag("unit")
    void systemHeadersComeFromCatalog() {
        DependencyNode stdio = new DependencyNode("<stdio.h>", SourceLanguage.SYSTEM, "", -1L,
                List.of(), List.of(), false);

        boolean ok = phase.collect(graphOf(stdio));

        assertThat(ok).isTrue();
        assertThat(symbolTable.resolve("fopen")).isPresent();
        verifyNoInteractions(cache, collector);
    }
}
