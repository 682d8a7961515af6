package com.juno.core.nodes;

import com.juno.core.config.JunoProperties;
import com.juno.core.evaluation.SystemEvaluationEngine;
import com.juno.core.events.EventBus;
import com.juno.core.events.JunoEvent;
import com.juno.core.events.JunoEventType;
import com.juno.core.logging.MdcContext;
import com.juno.core.metrics.JunoMetrics;
import com.juno.core.model.AppliedResourceChange;
import com.juno.core.model.CodeChange;
import com.juno.core.model.RunMessage;
import com.juno.core.model.Team;
import com.juno.core.router.TeamRun;
import com.juno.core.scaling.ResourceAllocator;
import com.juno.core.scaling.ResourceScalingEvaluator;
import com.juno.core.state.RunState;
import com.juno.core.state.StateUpdates;
import com.juno.core.teams.JunoTeam;
import com.juno.core.teams.TeamRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The improvement cycle.
 * <ol>
 *   <li>apply outstanding resource requests and report on earlier changes</li>
 *   <li>take an evaluation snapshot as the baseline for new code changes</li>
 *   <li>run the juno team (evaluator, code agent) on the open issues</li>
 *   <li>reset the streak and missed-deadline counters and move every team's
 *       improvement baseline to its current attempt count</li>
 * </ol>
 * Control always returns to the supervisor afterwards.
 */
@Component
public class JunoTeamNode {

    private static final Logger log = LoggerFactory.getLogger(JunoTeamNode.class);

    static final String AUTHOR = Team.JUNO.nodeName();
    static final String MONITOR = "resource_monitor";
    static final int ISSUE_LIMIT = 10;

    private final TeamRegistry teams;
    private final ResourceAllocator allocator;
    private final ResourceScalingEvaluator scalingEvaluator;
    private final SystemEvaluationEngine evaluationEngine;
    private final JunoProperties properties;
    private final JunoMetrics metrics;
    private final EventBus eventBus;

    public JunoTeamNode(TeamRegistry teams, ResourceAllocator allocator, ResourceScalingEvaluator scalingEvaluator,
                        SystemEvaluationEngine evaluationEngine, JunoProperties properties, JunoMetrics metrics,
                        EventBus eventBus) {
        this.teams = teams;
        this.allocator = allocator;
        this.scalingEvaluator = scalingEvaluator;
        this.evaluationEngine = evaluationEngine;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(RunState state) {
        MdcContext.setTeam(state.runId(), state.cycleCount(), Team.JUNO.id());
        try {
            var chain = StateUpdates.chain(state);
            chain.merge(monitoringReports(state));
            applyResources(chain);
            chain.then(this::snapshot);
            chain.then(this::improve);
            chain.then(this::reset);
            eventBus.publish(JunoEvent.of(JunoEventType.IMPROVEMENT_COMPLETED, state.runId(), Team.JUNO.id(),
                    Map.of("codeChanges", chain.state().codeChanges().size() - state.codeChanges().size(),
                            "resourceChanges", chain.state().resourceChangeHistory().size()
                                    - state.resourceChangeHistory().size())));
            return chain.delta();
        } finally {
            MdcContext.clearTeam();
        }
    }

    private void applyResources(StateUpdates.Chain chain) {
        RunState before = chain.state();
        if (before.resourceChangeRequests().isEmpty()) {
            return;
        }
        if (!properties.getResources().isScaling()) {
            log.info("Resource scaling is off, dropping {} request(s)", before.resourceChangeRequests().size());
            chain.merge(Map.of("resourceChangeRequests", List.of()));
            return;
        }
        chain.then(allocator::applyPendingRequests);
        var history = chain.state().resourceChangeHistory();
        for (var change : history.subList(before.resourceChangeHistory().size(), history.size())) {
            metrics.recordResourceChange(change.team(), change.oldAgents(), change.newAgents());
            eventBus.publish(JunoEvent.of(JunoEventType.RESOURCE_APPLIED, before.runId(), change.team(),
                    Map.of("oldAgents", change.oldAgents(), "newAgents", change.newAgents())));
        }
    }

    /** Reports on the latest change per team once records exist from after the change. */
    Map<String, Object> monitoringReports(RunState state) {
        var latest = new TreeMap<String, AppliedResourceChange>();
        for (var change : state.resourceChangeHistory()) {
            latest.merge(change.team(), change, (a, b) -> b.appliedAt().isBefore(a.appliedAt()) ? a : b);
        }
        var reports = new ArrayList<RunMessage>();
        for (var change : latest.values()) {
            boolean observed = state.metrics().stream()
                    .anyMatch(m -> m.teamName().equals(change.team()) && !m.endTime().isBefore(change.appliedAt()));
            if (observed) {
                reports.add(new RunMessage(MONITOR, scalingEvaluator.monitoringReport(state, change)));
            }
        }
        return reports.isEmpty() ? Map.of() : Map.of(RunState.MESSAGES, List.copyOf(reports));
    }

    private Map<String, Object> snapshot(RunState state) {
        var snapshots = new ArrayList<>(state.evaluationSnapshots());
        snapshots.add(evaluationEngine.snapshot(state));
        return Map.of("evaluationSnapshots", List.copyOf(snapshots));
    }

    private Map<String, Object> improve(RunState state) {
        var issues = openIssues(state);
        var context = new HashMap<String, Object>();
        context.put(JunoTeam.RUN_STATE, Map.copyOf(state.data()));
        context.put(JunoTeam.ISSUES, issues);
        context.put(JunoTeam.PRIOR_FIXES, state.fixesImplemented());
        context.put(JunoTeam.CYCLE, state.cycleCount());
        context.put(JunoTeam.CHANGE_BUDGET, codeChangeBudget(state, properties.getImprovement()));
        context.put(JunoTeam.CHANGE_SEQUENCE, state.codeChanges().size());
        context.put(JunoTeam.IMPROVEMENT_THRESHOLD, properties.getImprovement().getCodeImprovementThreshold());

        TeamRun run;
        try {
            run = teams.router(Team.JUNO).run(improvementTask(issues), context);
        } catch (RuntimeException e) {
            log.warn("Improvement team failed: {}", WorkerTeamNode.rootCauseMessage(e));
            return Map.of(RunState.MESSAGES, List.of(new RunMessage(AUTHOR,
                    "Improvement team failed: " + WorkerTeamNode.rootCauseMessage(e))));
        }

        var accepted = acceptedChanges(run);
        if (run.context().get(JunoTeam.REJECTED_CHANGES) instanceof Number rejected) {
            for (int i = 0; i < rejected.intValue(); i++) {
                metrics.recordCodeChange(false);
            }
        }
        var update = new HashMap<String, Object>();
        update.put(RunState.MESSAGES, List.of(new RunMessage(AUTHOR, run.output())));
        var identified = mergeIssues(state.issuesIdentified(), run.context().get(JunoTeam.ISSUES));
        if (identified.size() > state.issuesIdentified().size()) {
            update.put("issuesIdentified", identified);
        }
        if (!accepted.isEmpty()) {
            var changes = new ArrayList<>(state.codeChanges());
            changes.addAll(accepted);
            var fixes = new ArrayList<>(state.fixesImplemented());
            accepted.forEach(c -> fixes.add(c.description()));
            update.put("codeChanges", List.copyOf(changes));
            update.put("fixesImplemented", List.copyOf(fixes));
            for (var change : accepted) {
                metrics.recordCodeChange(true);
                eventBus.publish(JunoEvent.of(JunoEventType.CODE_CHANGE, state.runId(), Team.JUNO.id(),
                        Map.of("changeId", change.changeId(), "description", change.description())));
            }
        }
        return update;
    }

    private Map<String, Object> reset(RunState state) {
        var streaks = new HashMap<String, Integer>();
        state.lowQualityCounts().keySet().forEach(team -> streaks.put(team, 0));
        var improvedAt = new HashMap<>(state.improvedAt());
        for (Team team : properties.workerTeams()) {
            improvedAt.put(team.id(), state.agentPerformance(team.id()).totalAttempts());
        }
        return Map.of(
                "lowQualityCounts", Map.copyOf(streaks),
                "missedDeadlinesCount", 0,
                "improvedAt", Map.copyOf(improvedAt),
                "pendingRoute", "");
    }

    /**
     * Changes still allowed in the current cycle: none when code changes are
     * off or a change landed within the cooldown window of earlier cycles.
     */
    static int codeChangeBudget(RunState state, JunoProperties.Improvement improvement) {
        if (!improvement.isAllowCodeChanges()) {
            return 0;
        }
        int cycle = state.cycleCount();
        boolean coolingDown = state.codeChanges().stream()
                .anyMatch(c -> c.cycle() < cycle && cycle - c.cycle() < improvement.getCodeChangeCooldown());
        if (coolingDown) {
            return 0;
        }
        long thisCycle = state.codeChanges().stream().filter(c -> c.cycle() == cycle).count();
        return (int) Math.max(0, improvement.getMaxCodeChangesPerCycle() - thisCycle);
    }

    /** Most recent identified issues that no accepted change has addressed. */
    static List<String> openIssues(RunState state) {
        Set<String> fixed = state.codeChanges().stream()
                .flatMap(c -> c.issuesFixed().stream())
                .collect(Collectors.toSet());
        var open = state.issuesIdentified().stream().filter(i -> !fixed.contains(i)).distinct().toList();
        return List.copyOf(open.subList(Math.max(0, open.size() - ISSUE_LIMIT), open.size()));
    }

    /** Appends the evaluator's issues that the log does not already hold. */
    static List<String> mergeIssues(List<String> logged, Object found) {
        var merged = new ArrayList<>(logged);
        if (found instanceof List<?> list) {
            for (Object issue : list) {
                if (issue instanceof String text && !text.isBlank() && !merged.contains(text)) {
                    merged.add(text);
                }
            }
        }
        return List.copyOf(merged);
    }

    static String improvementTask(List<String> issues) {
        if (issues.isEmpty()) {
            return "Evaluate the system's performance and propose improvements.";
        }
        return "Evaluate the system's performance and fix these issues:\n"
                + issues.stream().map(i -> "- " + i).collect(Collectors.joining("\n"));
    }

    private static List<CodeChange> acceptedChanges(TeamRun run) {
        if (run.context().get(JunoTeam.ACCEPTED_CHANGES) instanceof List<?> list) {
            return list.stream().filter(CodeChange.class::isInstance).map(CodeChange.class::cast).toList();
        }
        return List.of();
    }
}
