package com.juno.core.scaling;

/**
 * Verdict on a resource change.
 *
 * @param success          true when the efficiency change is positive
 * @param narrative        human-readable description of the outcome band
 * @param efficiencyChange performance gain relative to the added resource cost, minus one
 */
public record ScalingAssessment(boolean success, String narrative, double efficiencyChange) {}
