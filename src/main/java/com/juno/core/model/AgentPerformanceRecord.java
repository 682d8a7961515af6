package com.juno.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated grading history for one team.
 */
public record AgentPerformanceRecord(
        String teamName,
        List<Double> qualityScores,
        int successCount,
        int errorCount,
        double totalTimeSeconds
) implements Serializable {

    public AgentPerformanceRecord {
        qualityScores = qualityScores == null ? List.of() : List.copyOf(qualityScores);
    }

    public static AgentPerformanceRecord empty(String teamName) {
        return new AgentPerformanceRecord(teamName, List.of(), 0, 0, 0.0);
    }

    public double avgQuality() {
        return qualityScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public double successRate() {
        int total = totalAttempts();
        return total == 0 ? 1.0 : (double) successCount / total;
    }

    public int totalAttempts() {
        return successCount + errorCount;
    }

    public boolean needsImprovement() {
        return needsImprovement(ImprovementPolicy.DEFAULT);
    }

    public boolean needsImprovement(ImprovementPolicy policy) {
        if (errorCount >= policy.errorLimit()) {
            return true;
        }
        if (qualityScores.size() >= policy.minQualitySamples() && avgQuality() < policy.qualityFloor()) {
            return true;
        }
        return totalAttempts() >= policy.minAttempts() && successRate() < policy.successRateFloor();
    }

    /** Appends a graded attempt. */
    public AgentPerformanceRecord withGrade(double score, boolean success, double durationSeconds) {
        var scores = new ArrayList<>(qualityScores);
        scores.add(score);
        return new AgentPerformanceRecord(teamName, scores,
                success ? successCount + 1 : successCount,
                success ? errorCount : errorCount + 1,
                totalTimeSeconds + durationSeconds);
    }
}
