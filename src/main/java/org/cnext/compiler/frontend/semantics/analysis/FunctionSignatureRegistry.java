package org.cnext.compiler.frontend.semantics.analysis;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The parameter passing decisions of every C-Next function analyzed so far in the run.
 * Both the generated definition and the generated prototype read their parameter
 * qualifiers from here, so the two always agree.
 */
public class FunctionSignatureRegistry {

    /**
     * How one parameter is passed.
     *
     * @param name          The parameter name.
     * @param explicitConst True if the parameter was declared {@code const}.
     * @param mutated       True if the function writes through the parameter.
     */
    public record ParameterMode(String name, boolean explicitConst, boolean mutated) {

        /**
         * True if the parameter is emitted with a {@code const} qualifier, either declared or inferred.
         */
        public boolean isConst() {
            return !mutated;
        }

        /**
         * True if the qualifier was inferred rather than written.
         */
        public boolean isAutoConst() {
            return !mutated && !explicitConst;
        }
    }

    private final Map<String, List<ParameterMode>> functions = new HashMap<>();

    public void record(String function, List<ParameterMode> modes) {
        functions.put(function, List.copyOf(modes));
    }

    public Optional<List<ParameterMode>> modes(String function) {
        return Optional.ofNullable(functions.get(function));
    }

    /**
     * Checks whether a function writes through its parameter at the given position.
     * Unknown functions, foreign functions included, never do.
     */
    public boolean isParameterMutated(String function, int index) {
        List<ParameterMode> modes = functions.get(function);
        return modes != null && index < modes.size() && modes.get(index).mutated();
    }
}
