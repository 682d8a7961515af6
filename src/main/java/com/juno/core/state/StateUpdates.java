package com.juno.core.state;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Merge rules for partial state updates, mirroring {@link RunState#SCHEMA}:
 * {@code messages} lists are concatenated, every other key is replaced.
 */
public final class StateUpdates {

    private StateUpdates() {}

    public static Map<String, Object> combine(Map<String, Object> base, Map<String, Object> updates) {
        var merged = new HashMap<String, Object>(base);
        updates.forEach((key, value) -> {
            if (RunState.MESSAGES.equals(key) && value instanceof List<?> added) {
                var messages = new ArrayList<Object>();
                if (merged.get(key) instanceof List<?> existing) {
                    messages.addAll(existing);
                }
                messages.addAll(added);
                merged.put(key, List.copyOf(messages));
            } else if (value != null) {
                merged.put(key, value);
            }
        });
        return merged;
    }

    /**
     * Starts a chain of steps over {@code state}. Each step sees the state
     * produced by the previous ones; {@link Chain#delta()} is the combined
     * update to hand back to the graph.
     */
    public static Chain chain(RunState state) {
        return new Chain(state);
    }

    public static final class Chain {

        private RunState state;
        private Map<String, Object> delta = Map.of();

        private Chain(RunState state) {
            this.state = state;
        }

        public Chain then(Function<RunState, Map<String, Object>> step) {
            return merge(step.apply(state));
        }

        public Chain merge(Map<String, Object> update) {
            state = state.apply(update);
            delta = combine(delta, update);
            return this;
        }

        public RunState state() {
            return state;
        }

        public Map<String, Object> delta() {
            return delta;
        }
    }
}
