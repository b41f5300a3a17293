package org.cnext.compiler.frontend.semantics.flow;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The facts known at one program point of a function body. Each analysis owns one map;
 * the analyses never look at each other's facts.
 */
public class FlowState {

    private final Map<String, InitState> init;
    private final Map<String, NullState> nulls;
    private boolean unreachable;

    public FlowState() {
        this(new HashMap<>(), new HashMap<>(), false);
    }

    private FlowState(Map<String, InitState> init, Map<String, NullState> nulls, boolean unreachable) {
        this.init = init;
        this.nulls = nulls;
        this.unreachable = unreachable;
    }

    public FlowState copy() {
        return new FlowState(new HashMap<>(init), new HashMap<>(nulls), unreachable);
    }

    /**
     * Meets two paths. A path that cannot reach the join point (it returned) does not take
     * part; variables known on only one path have gone out of scope and are dropped.
     */
    public static FlowState join(FlowState a, FlowState b) {
        if (a.unreachable) {
            return b.copy();
        }
        if (b.unreachable) {
            return a.copy();
        }
        FlowState result = new FlowState();
        a.init.forEach((name, state) -> {
            InitState other = b.init.get(name);
            if (other != null) {
                result.init.put(name, state.meet(other));
            }
        });
        a.nulls.forEach((name, state) -> {
            NullState other = b.nulls.get(name);
            if (other != null) {
                result.nulls.put(name, state.meet(other));
            }
        });
        return result;
    }

    public boolean isTracked(String name) {
        return init.containsKey(name);
    }

    public InitState initState(String name) {
        return init.getOrDefault(name, InitState.INITIALIZED);
    }

    public void setInitState(String name, InitState state) {
        init.put(name, state);
    }

    /**
     * Marks a variable as written if it is tracked.
     */
    public void markInitialized(String name) {
        if (init.containsKey(name)) {
            init.put(name, InitState.INITIALIZED);
        }
    }

    public NullState nullState(String name) {
        return nulls.getOrDefault(name, NullState.UNCHECKED);
    }

    public void setNullState(String name, NullState state) {
        nulls.put(name, state);
    }

    public boolean isUnreachable() {
        return unreachable;
    }

    public void markUnreachable() {
        this.unreachable = true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlowState other)) {
            return false;
        }
        return unreachable == other.unreachable && init.equals(other.init) && nulls.equals(other.nulls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(init, nulls, unreachable);
    }
}
