package com.juno.core.oracle;

/**
 * A supervisor's choice of the next node.
 *
 * @param next      member name, or {@code FINISH}
 * @param reasoning short justification from the router
 */
public record RouteDecision(String next, String reasoning) {
    public static final String FINISH = "FINISH";
}
