package com.juno.core.evaluation;

import java.time.Instant;

public record SystemReport(
        Instant generatedAt,
        TaskPerformanceReport taskPerformance,
        CodeImprovementReport codeImprovements,
        ResourceScalingReport resourceScaling,
        String narrative
) {}
