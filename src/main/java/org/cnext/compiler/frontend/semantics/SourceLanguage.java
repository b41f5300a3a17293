package org.cnext.compiler.frontend.semantics;

/**
 * The language a file or symbol originates from.
 */
public enum SourceLanguage {
    /** C-Next source, compiled by this tool. */
    CNEXT,
    /** A C header, read for interop only. */
    C,
    /** A C++ header, read for interop only. */
    CPP,
    /** A recognized system header, never parsed; described by built-in tables instead. */
    SYSTEM;

    /**
     * Checks whether files of this language are parsed by one of the foreign header grammars.
     */
    public boolean isForeignHeader() {
        return this == C || this == CPP;
    }
}
