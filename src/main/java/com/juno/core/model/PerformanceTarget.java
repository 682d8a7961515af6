package com.juno.core.model;

import java.io.Serializable;

/**
 * A named performance goal and the most recently measured value.
 */
public record PerformanceTarget(
        String metricName,
        double targetValue,
        double currentValue,
        String description
) implements Serializable {

    public boolean isMet() {
        return currentValue >= targetValue;
    }

    public PerformanceTarget withCurrentValue(double value) {
        return new PerformanceTarget(metricName, targetValue, value, description);
    }
}
