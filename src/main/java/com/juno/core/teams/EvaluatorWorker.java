package com.juno.core.teams;

import com.juno.core.evaluation.SystemEvaluationEngine;
import com.juno.core.router.TeamState;
import com.juno.core.router.TeamWorker;
import com.juno.core.router.WorkerResult;
import com.juno.core.state.RunState;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Improvement team member that measures the run: task performance against
 * targets and the effect of earlier code changes. Reads the run snapshot
 * data from the {@link JunoTeam#RUN_STATE} context key and adds an issue for
 * every unmet target to {@link JunoTeam#ISSUES}.
 */
public class EvaluatorWorker implements TeamWorker {

    public static final String NAME = "evaluator";

    private final SystemEvaluationEngine engine;

    public EvaluatorWorker(SystemEvaluationEngine engine) {
        this.engine = engine;
    }

    @Override
    public WorkerResult perform(TeamState state) {
        if (!(state.context().get(JunoTeam.RUN_STATE) instanceof Map<?, ?> data)) {
            throw new IllegalStateException("Evaluator needs the run state in its context");
        }
        @SuppressWarnings("unchecked")
        var run = new RunState((Map<String, Object>) data);
        var performance = engine.evaluateTaskPerformance(run);
        var improvements = engine.evaluateCodeImprovements(run, Optional.empty());

        var issues = new ArrayList<String>();
        if (state.context().get(JunoTeam.ISSUES) instanceof List<?> open) {
            open.forEach(i -> issues.add(String.valueOf(i)));
        }
        var sb = new StringBuilder("## Evaluation\n\n").append(performance.summary()).append('\n');
        for (var target : performance.targets()) {
            if (target.achieved()) {
                continue;
            }
            String issue = String.format(Locale.ROOT, "%s below target: %.2f of %.2f",
                    target.metric(), target.current(), target.target());
            sb.append("- ").append(issue).append('\n');
            if (!issues.contains(issue)) {
                issues.add(issue);
            }
        }
        sb.append('\n').append(improvements.summary());

        String content = sb.toString();
        return new WorkerResult(content,
                Map.of(JunoTeam.ISSUES, List.copyOf(issues),
                        JunoTeam.OVERALL_SCORE, performance.overallScore(),
                        JunoTeam.SUFFICIENT_DATA, performance.sufficientData(),
                        JunoTeam.EVALUATION, content),
                0);
    }
}
