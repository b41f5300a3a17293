package org.cnext.compiler.frontend.semantics;

/**
 * Coarse classification of a {@link TypeInfo}, used by the analyses that depend on
 * signedness and width.
 */
public enum TypeKind {
    SIGNED,
    UNSIGNED,
    FLOAT,
    BOOL,
    STRING,
    STRUCT,
    ENUM,
    POINTER,
    VOID,
    OPAQUE;

    public boolean isInteger() {
        return this == SIGNED || this == UNSIGNED;
    }

    public boolean isScalar() {
        return isInteger() || this == FLOAT || this == BOOL || this == ENUM;
    }
}
