package com.juno.core.evaluation;

public record MetricChange(double baseline, double current, double absoluteChange, double relativeChange) {}
