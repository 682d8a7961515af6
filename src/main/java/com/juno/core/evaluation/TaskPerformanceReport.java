package com.juno.core.evaluation;

import com.juno.core.model.TeamPerformance;

import java.util.List;
import java.util.Map;

/**
 * Aggregate performance over every task record of a run.
 *
 * @param sufficientData false when no task records exist; all figures are then zero
 * @param overallScore   0.25 x success rate + 0.35 x quality + 0.4 x deadline-met rate
 */
public record TaskPerformanceReport(
        boolean sufficientData,
        int totalTasks,
        double successRate,
        double avgQuality,
        double avgDurationSeconds,
        double deadlineMetRate,
        double avgTaskSize,
        double overallScore,
        Map<String, TeamPerformance> teams,
        List<TargetAssessment> targets,
        String summary
) {
    public static final String INSUFFICIENT_DATA = "Insufficient data to evaluate task performance.";

    public static TaskPerformanceReport insufficientData() {
        return new TaskPerformanceReport(false, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
                Map.of(), List.of(), INSUFFICIENT_DATA);
    }
}
