package com.juno.core.evaluation;

import com.juno.core.model.TeamPerformance;

public record TeamScalingResult(
        String team,
        int oldAgents,
        int newAgents,
        TeamPerformance before,
        TeamPerformance after,
        double efficiencyChange,
        String assessment
) {}
