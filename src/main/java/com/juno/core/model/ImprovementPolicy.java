package com.juno.core.model;

import java.io.Serializable;

/**
 * Thresholds behind {@link AgentPerformanceRecord#needsImprovement(ImprovementPolicy)}.
 * <p>
 * The quality check and the success-rate check use different minimum sample
 * sizes; both are kept as separate settings.
 *
 * @param errorLimit        error count that on its own signals improvement is needed
 * @param minQualitySamples scores required before average quality is judged
 * @param qualityFloor      average quality below which improvement is needed
 * @param minAttempts       attempts required before success rate is judged
 * @param successRateFloor  success rate below which improvement is needed
 */
public record ImprovementPolicy(
        int errorLimit,
        int minQualitySamples,
        double qualityFloor,
        int minAttempts,
        double successRateFloor
) implements Serializable {

    public static final ImprovementPolicy DEFAULT = new ImprovementPolicy(3, 3, 0.5, 5, 0.7);
}
