package com.juno.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Aggregate metrics captured at a point in the run, used as a baseline
 * when judging the impact of code changes.
 */
public record EvaluationSnapshot(
        String snapshotId,
        Instant takenAt,
        int cycle,
        double overallScore,
        double successRate,
        double avgQuality,
        double deadlineMetRate,
        double avgTaskSize
) implements Serializable {}
