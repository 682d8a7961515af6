package com.juno.core.evaluation;

import java.util.List;
import java.util.Map;

/**
 * Impact of code changes measured against a baseline evaluation snapshot.
 *
 * @param baselineId         snapshot used as baseline, empty when none was available
 * @param changes            per-metric change from baseline to now
 * @param complexityFactor   current over baseline average task size, when tasks got harder; 1.0 otherwise
 * @param overallImprovement relative change of the overall score scaled by the complexity factor
 */
public record CodeImprovementReport(
        int codeChangeCount,
        int fixesImplemented,
        String baselineId,
        Map<String, MetricChange> changes,
        double complexityFactor,
        double overallImprovement,
        List<String> changeIds,
        String summary
) {
    public static CodeImprovementReport noChanges() {
        return new CodeImprovementReport(0, 0, "", Map.of(), 1.0, 0.0, List.of(),
                "No code improvements have been implemented.");
    }
}
