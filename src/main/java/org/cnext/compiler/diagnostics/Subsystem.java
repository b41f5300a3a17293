package org.cnext.compiler.diagnostics;

/**
 * The compiler subsystem that owns a diagnostic code. Codes are namespaced by subsystem
 * so that tooling can filter on them.
 */
public enum Subsystem {
    PARSER,
    SYMBOLS,
    CONST,
    INITIALIZATION,
    SWITCH,
    PREPROCESSOR,
    NUMERIC,
    REGISTER,
    HEADER,
    NULL_SAFETY,
    IO
}
