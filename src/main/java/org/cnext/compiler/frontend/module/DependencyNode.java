package org.cnext.compiler.frontend.module;

import org.cnext.compiler.frontend.semantics.SourceLanguage;

import java.util.List;

/**
 * A file in the include tree. Each canonical path occurs in a tree at most once; a file
 * reached a second time is not re-descended and does not appear as a child again.
 *
 * @param absolutePath The canonical absolute path, or {@code <name>} for a system header.
 * @param language     The detected source language.
 * @param rawContent   The file text; empty for system headers and for headers served from the cache.
 * @param lastModified The modification time in milliseconds, or -1 for system headers.
 * @param includes     The include directives found in the file.
 * @param children     The resolved, first-visit dependencies in include order.
 * @param fromCache    True if the include list came from a valid cache entry and the file was not read.
 */
public record DependencyNode(String absolutePath, SourceLanguage language, String rawContent, long lastModified,
                             List<IncludeDirective> includes, List<DependencyNode> children, boolean fromCache) {

    public DependencyNode {
        includes = List.copyOf(includes);
        children = List.copyOf(children);
    }
}
