package org.cnext.compiler.frontend.semantics;

/**
 * The tag of the closed {@link Symbol} variant.
 */
public enum SymbolKind {
    FUNCTION,
    STRUCT,
    ENUM,
    TYPEDEF,
    MACRO_CONSTANT,
    VARIABLE
}
