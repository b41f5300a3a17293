package org.cnext.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A type as written in C-Next source.
 *
 * @param name            The type name: a primitive such as {@code u32}, {@code string}, or a user type.
 * @param stringCapacity  The capacity of {@code string<N>}, or 0.
 * @param arrayDimensions The array dimension expressions, outermost first.
 * @param position        The location of the type name.
 */
public record TypeRef(String name, int stringCapacity, List<Expression> arrayDimensions, SourcePosition position)
        implements AstNode, SourceLocatable {

    public TypeRef {
        arrayDimensions = List.copyOf(arrayDimensions);
    }

    public static TypeRef simple(String name, SourcePosition position) {
        return new TypeRef(name, 0, List.of(), position);
    }

    public boolean isString() {
        return "string".equals(name);
    }

    public boolean isArray() {
        return !arrayDimensions.isEmpty();
    }

    public TypeRef withArrayDimensions(List<Expression> dimensions) {
        return new TypeRef(name, stringCapacity, dimensions, position);
    }

    public TypeRef withName(String newName) {
        return new TypeRef(newName, stringCapacity, arrayDimensions, position);
    }

    @Override
    public String toString() {
        return isString() ? "string<" + stringCapacity + ">" : name;
    }
}
