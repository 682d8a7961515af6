package com.juno.core.grading;

import com.juno.core.oracle.GradeResult;

import java.util.List;
import java.util.Map;

/**
 * Result of grading one team output.
 *
 * @param grade             the grade applied (possibly the neutral fallback)
 * @param deadlineMet       whether the output arrived before the task deadline
 * @param escalationReasons why the improvement team was called in; empty when it was not
 * @param update            state update to apply
 */
public record GradingOutcome(
        GradeResult grade,
        boolean deadlineMet,
        List<String> escalationReasons,
        Map<String, Object> update
) {
    public boolean escalated() {
        return !escalationReasons.isEmpty();
    }
}
