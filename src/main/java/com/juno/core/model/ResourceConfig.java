package com.juno.core.model;

import java.io.Serializable;

/**
 * Agent allocation for one team. Always satisfies {@code min <= current <= max}.
 */
public record ResourceConfig(
        int currentAgents,
        int minAgents,
        int maxAgents,
        double scalingFactor
) implements Serializable {

    public ResourceConfig {
        if (minAgents > maxAgents) {
            throw new IllegalArgumentException("minAgents " + minAgents + " exceeds maxAgents " + maxAgents);
        }
        if (currentAgents < minAgents || currentAgents > maxAgents) {
            throw new IllegalArgumentException("currentAgents " + currentAgents
                    + " outside [" + minAgents + ", " + maxAgents + "]");
        }
    }

    public boolean canScaleUp() {
        return currentAgents < maxAgents;
    }

    /** Returns a copy with the agent count clamped into the configured bounds. */
    public ResourceConfig withAgents(int agents) {
        int clamped = Math.max(minAgents, Math.min(maxAgents, agents));
        return new ResourceConfig(clamped, minAgents, maxAgents, scalingFactor);
    }
}
