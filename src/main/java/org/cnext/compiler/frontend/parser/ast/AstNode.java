package org.cnext.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public interface AstNode {

    /**
     * Returns the direct child nodes of this node, used by generic tree walks.
     * @return A list of child nodes, or an empty list if this node has no children.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
