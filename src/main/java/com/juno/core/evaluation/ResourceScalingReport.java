package com.juno.core.evaluation;

import java.util.Map;

/**
 * Effect of the most recent resource change of every scaled team.
 *
 * @param overallEffectiveness mean efficiency change across scaled teams
 */
public record ResourceScalingReport(Map<String, TeamScalingResult> teams, double overallEffectiveness, String summary) {

    public static ResourceScalingReport none() {
        return new ResourceScalingReport(Map.of(), 0.0, "No resource scaling has been performed.");
    }
}
