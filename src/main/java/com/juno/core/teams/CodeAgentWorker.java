package com.juno.core.teams;

import com.juno.core.model.CodeChange;
import com.juno.core.oracle.CodeFixProposal;
import com.juno.core.oracle.Oracle;
import com.juno.core.router.TeamState;
import com.juno.core.router.TeamWorker;
import com.juno.core.router.WorkerResult;
import com.juno.sandbox.CodeSandbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Improvement team member that turns open issues into code fixes. Each
 * proposed fix runs in the {@link CodeSandbox} first; only fixes that run
 * cleanly become {@link CodeChange}s.
 * <p>
 * Nothing is proposed when the change budget is spent, when no issue is
 * open, or when the evaluator reported an overall score at or above the
 * improvement threshold.
 */
public class CodeAgentWorker implements TeamWorker {

    private static final Logger log = LoggerFactory.getLogger(CodeAgentWorker.class);

    public static final String NAME = "code_agent";

    private final Oracle oracle;
    private final CodeSandbox sandbox;
    private final Clock clock;

    public CodeAgentWorker(Oracle oracle, CodeSandbox sandbox, Clock clock) {
        this.oracle = oracle;
        this.sandbox = sandbox;
        this.clock = clock;
    }

    @Override
    public WorkerResult perform(TeamState state) {
        var context = state.context();
        int budget = intValue(context.get(JunoTeam.CHANGE_BUDGET));
        List<String> issues = stringList(context.get(JunoTeam.ISSUES));

        if (budget <= 0) {
            return skipped("Code changes are not allowed in this cycle.");
        }
        if (issues.isEmpty()) {
            return skipped("No open issues to fix.");
        }
        if (Boolean.TRUE.equals(context.get(JunoTeam.SUFFICIENT_DATA))
                && context.get(JunoTeam.OVERALL_SCORE) instanceof Number score
                && context.get(JunoTeam.IMPROVEMENT_THRESHOLD) instanceof Number threshold
                && score.doubleValue() >= threshold.doubleValue()) {
            return skipped(String.format(Locale.ROOT, "Overall score %.2f meets the improvement threshold; no code changes needed.",
                    score.doubleValue()));
        }

        CodeFixProposal proposal;
        try {
            proposal = oracle.proposeCodeFix(issues, stringList(context.get(JunoTeam.PRIOR_FIXES)));
        } catch (RuntimeException e) {
            log.warn("Code fix proposal failed: {}", e.getMessage());
            return skipped("Code fix proposal failed: " + e.getMessage());
        }

        int cycle = intValue(context.get(JunoTeam.CYCLE));
        int sequence = intValue(context.get(JunoTeam.CHANGE_SEQUENCE));
        var accepted = new ArrayList<CodeChange>();
        int rejected = 0;
        var report = new StringBuilder("## Code changes\n\n").append(proposal.narrative()).append("\n\n");

        for (var fix : proposal.fixes()) {
            if (accepted.size() >= budget) {
                report.append("- skipped (change limit reached): ").append(fix.description()).append('\n');
                continue;
            }
            if (fix.code().isBlank()) {
                rejected++;
                report.append("- rejected (no code): ").append(fix.description()).append('\n');
                continue;
            }
            var result = sandbox.submit(fix.code(), Map.of("issues", fix.issues(), "cycle", cycle));
            if (result.failed()) {
                rejected++;
                report.append("- rejected (sandbox error): ").append(fix.description())
                        .append("\n  ").append(firstLine(result.stderr())).append('\n');
                continue;
            }
            sequence++;
            accepted.add(new CodeChange("change-" + sequence, cycle, fix.description(), fix.code(),
                    fix.issues().isEmpty() ? issues : fix.issues(), clock.instant()));
            report.append("- applied: ").append(fix.description()).append('\n');
        }
        log.info("Code agent accepted {} and rejected {} fix(es)", accepted.size(), rejected);

        String content = report.toString();
        var allAccepted = new ArrayList<>(changeList(context.get(JunoTeam.ACCEPTED_CHANGES)));
        allAccepted.addAll(accepted);
        return new WorkerResult(content,
                Map.of(JunoTeam.ACCEPTED_CHANGES, List.copyOf(allAccepted),
                        JunoTeam.REJECTED_CHANGES, rejected,
                        JunoTeam.CHANGE_SEQUENCE, sequence,
                        JunoTeam.CHANGE_BUDGET, budget - accepted.size()),
                WorkerResult.estimateTokens(content));
    }

    private static WorkerResult skipped(String reason) {
        return new WorkerResult(reason, Map.of(), 0);
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }

    private static int intValue(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }

    @SuppressWarnings("unchecked")
    static List<CodeChange> changeList(Object value) {
        return value instanceof List<?> list ? (List<CodeChange>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    private static List<String> stringList(Object value) {
        return value instanceof List<?> list ? (List<String>) list : List.of();
    }
}
