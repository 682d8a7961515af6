package com.juno.core.oracle;

import com.juno.core.model.RunMessage;

import java.util.List;

/**
 * Typed boundary to the language model. Implementations parse the model's
 * answers; callers treat any {@link RuntimeException} as a failed call and
 * substitute a neutral default.
 */
public interface Oracle {

    GradeResult grade(String team, String task, String result);

    /**
     * Picks the next node for a supervisor.
     *
     * @param supervisor name of the deciding supervisor
     * @param history    conversation so far
     * @param options    valid member names; {@link RouteDecision#FINISH} is always allowed
     */
    RouteDecision route(String supervisor, List<RunMessage> history, List<String> options);

    GeneratedTask generateTask(String category);

    CodeFixProposal proposeCodeFix(List<String> issues, List<String> priorFixes);

    /**
     * Writes an analysis of the numeric evaluation summary.
     *
     * @param summaryJson evaluation reports serialized as JSON
     */
    String synthesizeReport(String summaryJson);
}
