package org.cnext.compiler.frontend.semantics.flow;

/**
 * Definite-initialization lattice of one local variable.
 */
public enum InitState {
    UNINITIALIZED,
    MAYBE_INITIALIZED,
    INITIALIZED;

    /**
     * The conservative meet of two paths.
     */
    public InitState meet(InitState other) {
        return this == other ? this : MAYBE_INITIALIZED;
    }
}
