package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.frontend.module.DependencyNode;
import org.cnext.compiler.frontend.semantics.Symbol;

import java.util.List;
import java.util.Optional;

/**
 * Persistent store of the symbols collected from foreign headers.
 */
public interface HeaderSymbolCache {

    /** A store that never hits and discards everything. */
    HeaderSymbolCache NONE = new HeaderSymbolCache() {
        @Override
        public Optional<List<Symbol>> cachedSymbols(String absolutePath, long lastModified) {
            return Optional.empty();
        }

        @Override
        public void store(DependencyNode header, List<Symbol> symbols) {
        }
    };

    /**
     * Returns the cached symbols of a header if its entry is still valid.
     *
     * @param absolutePath The canonical path of the header.
     * @param lastModified The current modification time of the header.
     */
    Optional<List<Symbol>> cachedSymbols(String absolutePath, long lastModified);

    /**
     * Records the symbols freshly collected from a header.
     */
    void store(DependencyNode header, List<Symbol> symbols);
}
