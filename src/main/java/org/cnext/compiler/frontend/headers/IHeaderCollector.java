package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;

import java.util.List;

/**
 * Interface for the foreign header grammars. A collector reads one header and registers the
 * declarations it understands in the symbol table.
 */
public interface IHeaderCollector {

    /**
     * Collects the symbols of a single header.
     *
     * @param header      The header node; its raw content is parsed.
     * @param symbolTable The symbol table to register symbols in; also used to resolve types
     *                    declared by headers collected earlier.
     * @param diagnostics The engine for reporting parse errors.
     * @return The symbols produced by this header, in declaration order.
     */
    List<Symbol> collect(DependencyNode header, SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
