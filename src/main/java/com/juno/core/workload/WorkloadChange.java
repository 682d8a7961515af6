package com.juno.core.workload;

/**
 * Outcome of a workload increase check.
 *
 * @param changed        whether the task size multiplier changed
 * @param sizeMultiplier multiplier in force after the check
 */
public record WorkloadChange(boolean changed, double sizeMultiplier) {

    public static WorkloadChange unchanged(double sizeMultiplier) {
        return new WorkloadChange(false, sizeMultiplier);
    }
}
