package org.cnext.compiler.backend.register;

import java.util.Locale;

/**
 * Hardware access mode of a register field.
 */
public enum RegisterAccess {
    /** Read-write. */
    RW,
    /** Read-only. */
    RO,
    /** Write-only. */
    WO,
    /** Write 1 to clear; reads have side effects or return garbage. */
    W1C,
    /** Write 1 to set. */
    W1S;

    public static RegisterAccess fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }

    /**
     * True if the field may be read, including the implicit read of a read-modify-write.
     */
    public boolean isReadable() {
        return this == RW || this == RO;
    }

    public boolean isWritable() {
        return this != RO;
    }

    /**
     * True for fields where only written one bits have an effect.
     */
    public boolean isWriteOneToAct() {
        return this == W1C || this == W1S;
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
