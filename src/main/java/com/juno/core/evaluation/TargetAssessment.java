package com.juno.core.evaluation;

/**
 * How one configured target compares with the measured value.
 *
 * @param gap shortfall below the target, zero when achieved
 */
public record TargetAssessment(String metric, double target, double current, boolean achieved, double gap) {}
