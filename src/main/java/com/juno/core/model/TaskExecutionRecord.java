package com.juno.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * One team's logged attempt at a unit of work.
 * <p>
 * Records are appended to the run's metrics log when a team finishes or fails
 * and are never modified afterwards, except for the single quality patch
 * applied by the review step via {@link #withQuality(double)}.
 *
 * @param taskId       identifier of the task the attempt belongs to
 * @param teamName     team that performed the work
 * @param agentName    agent (or team supervisor) that produced the output
 * @param description  human-readable task description
 * @param startTime    when the work started
 * @param endTime      when the work finished or failed
 * @param deadline     deadline in force for the task, or {@code null} when none was set
 * @param success      whether the team produced output without error
 * @param errorMessage error text for failed attempts, empty otherwise
 * @param quality      quality score in [0, 1]
 * @param taskSize     relative size multiplier (1.0 = standard)
 * @param tokensUsed   token/cost counter
 * @param agentCount   agents allocated to the team while the work ran
 */
public record TaskExecutionRecord(
        String taskId,
        String teamName,
        String agentName,
        String description,
        Instant startTime,
        Instant endTime,
        Instant deadline,
        boolean success,
        String errorMessage,
        double quality,
        double taskSize,
        long tokensUsed,
        int agentCount
) implements Serializable {

    public TaskExecutionRecord {
        errorMessage = errorMessage == null ? "" : errorMessage;
        description = description == null ? "" : description;
    }

    /**
     * Single definition of deadline compliance shared by every component:
     * no deadline means met, otherwise the end must not be after the deadline.
     */
    public static boolean isDeadlineMet(Instant end, Instant deadline) {
        return deadline == null || !end.isAfter(deadline);
    }

    public double durationSeconds() {
        return Duration.between(startTime, endTime).toMillis() / 1000.0;
    }

    public boolean deadlineMet() {
        return isDeadlineMet(endTime, deadline);
    }

    /**
     * Signed slack relative to the deadline: positive when finished early,
     * negative on overrun, zero when no deadline was set.
     */
    public double deadlineBufferSeconds() {
        if (deadline == null) {
            return 0.0;
        }
        return Duration.between(endTime, deadline).toMillis() / 1000.0;
    }

    public TaskExecutionRecord withQuality(double newQuality) {
        return new TaskExecutionRecord(taskId, teamName, agentName, description, startTime, endTime,
                deadline, success, errorMessage, Math.max(0.0, Math.min(1.0, newQuality)),
                taskSize, tokensUsed, agentCount);
    }
}
