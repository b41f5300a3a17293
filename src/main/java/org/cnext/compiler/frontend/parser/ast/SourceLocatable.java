package org.cnext.compiler.frontend.parser.ast;

/**
 * Capability interface for AST nodes that carry a source location.
 */
public interface SourceLocatable {

    SourcePosition position();

    /**
     * Returns the file path of the source file this node originated from.
     */
    default String getSourceFileName() {
        return position().fileName();
    }
}
