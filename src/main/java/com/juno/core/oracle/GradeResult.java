package com.juno.core.oracle;

import java.util.List;

/**
 * Grade for one team output.
 *
 * @param score    quality score in [0, 1]
 * @param comments grader's remarks
 * @param issues   problems found, one per entry
 */
public record GradeResult(double score, String comments, List<String> issues) {

    public static final double NEUTRAL_SCORE = 0.5;

    public GradeResult {
        comments = comments == null ? "" : comments;
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /** Neutral grade substituted when the grader's answer cannot be used. */
    public static GradeResult parseError(String detail) {
        return new GradeResult(NEUTRAL_SCORE, "Grading failed: " + detail,
                List.of("parse error: grader response could not be parsed"));
    }
}
