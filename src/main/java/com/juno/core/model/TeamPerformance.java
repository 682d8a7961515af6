package com.juno.core.model;

import java.io.Serializable;

/**
 * Averages over a set of task records.
 */
public record TeamPerformance(
        double avgQuality,
        double successRate,
        double avgDurationSeconds,
        double deadlineMetRate
) implements Serializable {

    public static final TeamPerformance ZERO = new TeamPerformance(0.0, 0.0, 0.0, 0.0);
}
