package org.cnext.compiler.frontend.semantics.flow;

/**
 * Null-check lattice of one nullable ({@code c_}) variable.
 */
public enum NullState {
    UNCHECKED,
    NOT_NULL;

    public NullState meet(NullState other) {
        return this == NOT_NULL && other == NOT_NULL ? NOT_NULL : UNCHECKED;
    }
}
