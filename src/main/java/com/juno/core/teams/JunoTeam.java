package com.juno.core.teams;

/**
 * Member names and context keys of the improvement team.
 */
public final class JunoTeam {

    private JunoTeam() {}

    // Inputs supplied by the improvement node
    /** Run state data map, read back as a {@code RunState}. */
    public static final String RUN_STATE = "runState";
    public static final String ISSUES = "issues";
    public static final String PRIOR_FIXES = "priorFixes";
    public static final String CYCLE = "cycle";
    public static final String CHANGE_BUDGET = "changeBudget";
    public static final String CHANGE_SEQUENCE = "changeSequence";
    public static final String IMPROVEMENT_THRESHOLD = "improvementThreshold";

    // Written by the evaluator
    public static final String EVALUATION = "evaluation";
    public static final String OVERALL_SCORE = "overallScore";
    public static final String SUFFICIENT_DATA = "sufficientData";

    // Written by the code agent
    public static final String ACCEPTED_CHANGES = "acceptedChanges";
    public static final String REJECTED_CHANGES = "rejectedChanges";
}
