package org.cnext.compiler.frontend.semantics;

/**
 * Where a symbol was declared.
 *
 * @param file     The canonical path of the declaring file.
 * @param line     The 1-based declaration line, or 0 if unknown.
 * @param language The language of the declaring file.
 */
public record SymbolOrigin(String file, int line, SourceLanguage language) {

    @Override
    public String toString() {
        return language + " (" + file + ":" + line + ")";
    }
}
