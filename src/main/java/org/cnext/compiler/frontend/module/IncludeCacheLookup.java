package org.cnext.compiler.frontend.module;

import org.cnext.compiler.frontend.semantics.SourceLanguage;

import java.util.List;
import java.util.Optional;

/**
 * Source of previously resolved include lists for foreign headers.
 */
@FunctionalInterface
public interface IncludeCacheLookup {

    /** A lookup that never hits. */
    IncludeCacheLookup NONE = (path, lastModified) -> Optional.empty();

    /**
     * The cached scan result of one header.
     *
     * @param language The language detected when the header was last read.
     * @param includes The include directives of the header.
     */
    record CachedHeader(SourceLanguage language, List<IncludeDirective> includes) {

        public CachedHeader {
            includes = List.copyOf(includes);
        }
    }

    /**
     * Returns the cached scan result of a header if the cached entry is still valid.
     *
     * @param absolutePath The canonical path of the header.
     * @param lastModified The current modification time of the header.
     * @return The cached result, or empty on a miss or a stale entry.
     */
    Optional<CachedHeader> lookup(String absolutePath, long lastModified);
}
