package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.diagnostics.DiagnosticCode;
import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.io.SourceLoader;
import org.cnext.compiler.frontend.module.DependencyGraph;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.semantics.SourceLanguage;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.SystemHeaderCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Walks a dependency graph leaves-first and fills the symbol table from every header.
 * System headers contribute their catalog symbols; C and C++ headers are parsed by the
 * collector registered for their language, unless a valid cache entry provides the symbols.
 *
 * <p>A parse error in one header does not stop the walk: every header is attempted so that
 * all header diagnostics are reported together.</p>
 */
public class SymbolCollectionPhase {

    private static final Logger log = LoggerFactory.getLogger(SymbolCollectionPhase.class);

    private final SymbolTable symbolTable;
    private final DiagnosticsEngine diagnostics;
    private final HeaderCollectorRegistry registry;
    private final HeaderSymbolCache cache;

    public SymbolCollectionPhase(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        this(symbolTable, diagnostics, HeaderCollectorRegistry.initializeWithDefaults(), HeaderSymbolCache.NONE);
    }

    public SymbolCollectionPhase(SymbolTable symbolTable, DiagnosticsEngine diagnostics,
                                 HeaderCollectorRegistry registry, HeaderSymbolCache cache) {
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
        this.registry = registry;
        this.cache = cache;
    }

    /**
     * Collects the symbols of every header in the graph.
     *
     * @param graph The resolved dependency graph.
     * @return true if collection finished without errors.
     */
    public boolean collect(DependencyGraph graph) {
        int errorsBefore = diagnostics.errorCount();
        int parsed = 0;
        int cached = 0;
        for (DependencyNode node : graph.leavesFirstOrder()) {
            if (node.language() == SourceLanguage.SYSTEM) {
                String header = node.absolutePath().substring(1, node.absolutePath().length() - 1);
                symbolTable.defineAll(SystemHeaderCatalog.symbolsFor(header));
            } else if (node.language().isForeignHeader()) {
                Optional<List<Symbol>> fromCache = cache.cachedSymbols(node.absolutePath(), node.lastModified());
                if (fromCache.isPresent()) {
                    symbolTable.defineAll(fromCache.get());
                    cached++;
                } else {
                    collectHeader(node);
                    parsed++;
                }
            }
        }
        log.debug("Collected header symbols: {} parsed, {} from cache", parsed, cached);
        return diagnostics.errorCount() == errorsBefore;
    }

    private void collectHeader(DependencyNode node) {
        DependencyNode source = node;
        if (node.fromCache()) {
            // The include list was cached but the symbols were not; read the file after all.
            try {
                SourceLoader.LoadResult loaded = SourceLoader.loadFile(Path.of(node.absolutePath()));
                source = new DependencyNode(node.absolutePath(), node.language(), loaded.content(),
                        node.lastModified(), node.includes(), node.children(), false);
            } catch (IOException e) {
                diagnostics.reportError(DiagnosticCode.IO_ERROR, "Could not read header: " + e.getMessage(),
                        node.absolutePath(), 0, 0);
                return;
            }
        }
        IHeaderCollector collector = registry.resolve(node.language())
                .orElseThrow(() -> new IllegalStateException("No collector for " + node.language()));
        int errorsBefore = diagnostics.errorCount();
        List<Symbol> symbols = collector.collect(source, symbolTable, diagnostics);
        if (diagnostics.errorCount() == errorsBefore) {
            cache.store(source, symbols);
        }
    }
}
