package org.cnext.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of one C-Next translation unit.
 *
 * @param fileName     The canonical path of the source file.
 * @param declarations The top-level declarations in source order.
 */
public record Program(String fileName, List<Declaration> declarations) implements AstNode {

    public Program {
        declarations = List.copyOf(declarations);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(declarations);
    }
}
