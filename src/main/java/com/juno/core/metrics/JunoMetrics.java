package com.juno.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Juno runs.
 */
@Service
public class JunoMetrics {

    private final MeterRegistry registry;

    public JunoMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTeamExecution(String team, boolean success, long ms) {
        Timer.builder("juno.team.duration")
                .tag("team", team)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGrade(String team, double score) {
        DistributionSummary.builder("juno.team.grade")
                .tag("team", team)
                .register(registry)
                .record(score);
    }

    public void recordDeadlineMiss(String team) {
        Counter.builder("juno.deadline.misses")
                .tag("team", team)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("juno.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordWorkloadIncrease(double multiplier) {
        DistributionSummary.builder("juno.workload.multiplier")
                .register(registry)
                .record(multiplier);
    }

    public void recordResourceChange(String team, int oldAgents, int newAgents) {
        Counter.builder("juno.resources.changes")
                .tag("team", team)
                .tag("direction", newAgents >= oldAgents ? "up" : "down")
                .register(registry)
                .increment();
    }

    public void recordCodeChange(boolean accepted) {
        Counter.builder("juno.code.changes")
                .tag("result", accepted ? "accepted" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordCycleCompleted() {
        Counter.builder("juno.cycles.completed")
                .register(registry)
                .increment();
    }

    public void recordRunResult(String outcome) {
        Counter.builder("juno.runs.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
