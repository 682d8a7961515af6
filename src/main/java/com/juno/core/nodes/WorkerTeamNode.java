package com.juno.core.nodes;

import com.juno.core.config.JunoProperties;
import com.juno.core.events.EventBus;
import com.juno.core.events.JunoEvent;
import com.juno.core.events.JunoEventType;
import com.juno.core.grading.GradingOutcome;
import com.juno.core.grading.GradingService;
import com.juno.core.grading.ReviewService;
import com.juno.core.logging.MdcContext;
import com.juno.core.metrics.JunoMetrics;
import com.juno.core.model.RunMessage;
import com.juno.core.model.TaskExecutionRecord;
import com.juno.core.model.Team;
import com.juno.core.state.RunState;
import com.juno.core.state.StateUpdates;
import com.juno.core.teams.TeamRegistry;
import com.juno.core.workload.WorkloadManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one worker team on the current task and grades the result.
 * <p>
 * The first team to work on a task also applies the workload adjustments
 * (size increase, deadline, resource request). The team's attempt is logged
 * as a {@link TaskExecutionRecord}; a team that throws is logged as a
 * failed attempt and graded as a failure instead of ending the run.
 */
@Component
public class WorkerTeamNode {

    private static final Logger log = LoggerFactory.getLogger(WorkerTeamNode.class);

    private final TeamRegistry teams;
    private final WorkloadManager workloadManager;
    private final GradingService gradingService;
    private final ReviewService reviewService;
    private final JunoProperties properties;
    private final JunoMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    public WorkerTeamNode(TeamRegistry teams, WorkloadManager workloadManager, GradingService gradingService,
                          ReviewService reviewService, JunoProperties properties, JunoMetrics metrics,
                          EventBus eventBus, Clock clock) {
        this.teams = teams;
        this.workloadManager = workloadManager;
        this.gradingService = gradingService;
        this.reviewService = reviewService;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Map<String, Object> apply(RunState state, Team team) {
        MdcContext.setTeam(state.runId(), state.cycleCount(), team.id());
        try {
            var chain = StateUpdates.chain(state);
            if (state.gradedTeams().isEmpty()) {
                chain.then(s -> workloadManager.applyAdjustments(s, properties));
                publishWorkloadEvents(state, chain.state(), team);
            }
            RunState current = chain.state();
            int agents = current.agentCount(team.id());
            Instant deadline = current.currentTaskDeadline().orElse(null);
            Instant start = clock.instant();

            GradingOutcome outcome;
            try {
                var run = teams.router(team).run(taskPrompt(current, team), Map.of());
                Instant end = clock.instant();
                var record = new TaskExecutionRecord(taskId(current), team.id(), team.nodeName(),
                        current.currentTask(), start, end, deadline, true, "", 0.0,
                        current.currentTaskSize(), run.tokensUsed(), agents);
                chain.merge(logAttempt(current, record, run.output()));
                outcome = gradingService.gradeOutput(chain.state(), team, run.output(), properties);
                metrics.recordTeamExecution(team.id(), true, Duration.between(start, end).toMillis());
                eventBus.publish(JunoEvent.of(JunoEventType.TEAM_COMPLETED, state.runId(), team.id(),
                        Map.of("steps", run.visited().size(), "tokens", run.tokensUsed())));
            } catch (RuntimeException e) {
                String error = rootCauseMessage(e);
                log.warn("Team {} failed: {}", team.id(), error);
                Instant end = clock.instant();
                var record = new TaskExecutionRecord(taskId(current), team.id(), team.nodeName(),
                        current.currentTask(), start, end, deadline, false, error, 0.0,
                        current.currentTaskSize(), 0, agents);
                chain.merge(logAttempt(current, record, "Team execution failed: " + error));
                outcome = gradingService.gradeFailure(chain.state(), team, error, properties);
                metrics.recordTeamExecution(team.id(), false, Duration.between(start, end).toMillis());
                eventBus.publish(JunoEvent.of(JunoEventType.TEAM_FAILED, state.runId(), team.id(), Map.of("error", error)));
            }

            chain.merge(outcome.update());
            var grade = outcome.grade();
            chain.then(s -> reviewService.review(s, team.id(), grade));
            recordGrade(state.runId(), team, outcome);
            return chain.delta();
        } finally {
            MdcContext.clearTeam();
        }
    }

    private Map<String, Object> logAttempt(RunState state, TaskExecutionRecord record, String output) {
        var records = new ArrayList<>(state.metrics());
        records.add(record);
        var results = new HashMap<>(state.teamResults());
        results.put(record.teamName(), output);
        return Map.of(
                "metrics", List.copyOf(records),
                "teamResults", Map.copyOf(results),
                RunState.MESSAGES, List.of(new RunMessage(record.agentName(), output)));
    }

    private void recordGrade(String runId, Team team, GradingOutcome outcome) {
        metrics.recordGrade(team.id(), outcome.grade().score());
        if (!outcome.deadlineMet()) {
            metrics.recordDeadlineMiss(team.id());
        }
        eventBus.publish(JunoEvent.of(JunoEventType.TEAM_GRADED, runId, team.id(),
                Map.of("score", outcome.grade().score(), "deadlineMet", outcome.deadlineMet())));
        if (outcome.escalated()) {
            outcome.escalationReasons().forEach(metrics::incrementEscalations);
            eventBus.publish(JunoEvent.of(JunoEventType.IMPROVEMENT_ESCALATED, runId, team.id(),
                    Map.of("reasons", outcome.escalationReasons())));
        }
    }

    private void publishWorkloadEvents(RunState before, RunState after, Team team) {
        String runId = before.runId();
        if (after.currentTaskSize() > before.currentTaskSize()) {
            metrics.recordWorkloadIncrease(after.currentTaskSize());
            eventBus.publish(JunoEvent.of(JunoEventType.WORKLOAD_INCREASED, runId, team.id(),
                    Map.of("taskSize", after.currentTaskSize())));
        }
        if (before.currentTaskDeadline().isEmpty()) {
            after.currentTaskDeadline().ifPresent(deadline ->
                    eventBus.publish(JunoEvent.of(JunoEventType.DEADLINE_ASSIGNED, runId, team.id(),
                            Map.of("deadline", deadline.toString()))));
        }
        var requests = after.resourceChangeRequests();
        if (requests.size() > before.resourceChangeRequests().size()) {
            var request = requests.get(requests.size() - 1);
            eventBus.publish(JunoEvent.of(JunoEventType.RESOURCE_REQUESTED, runId, request.team(),
                    Map.of("currentAgents", request.currentAgents(),
                            "recommendedAgents", request.recommendedAgents())));
        }
    }

    /** The writing team builds on what the research team found. */
    static String taskPrompt(RunState state, Team team) {
        var prompt = new StringBuilder(state.currentTask());
        if (team == Team.WRITING) {
            String research = state.teamResults().get(Team.RESEARCH.id());
            if (research != null && !research.isBlank()) {
                prompt.append("\n\nResearch findings:\n").append(research);
            }
        }
        return prompt.toString();
    }

    static String taskId(RunState state) {
        return state.runId() + "-task-" + state.cycleCount();
    }

    static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }
}
