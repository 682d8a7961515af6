package com.juno.core.state;

import com.juno.core.model.*;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Run aggregate for the Juno workflow.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors for every
 * field of a run. Only {@code messages} is an appender channel; all other
 * channels are replaced wholesale, so every component returns fresh copies
 * of the collections it changes and never mutates a snapshot in place.
 */
public class RunState extends AgentState {

    public static final String MESSAGES = "messages";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Run and task ─────────────────────────────────────────────
        Map.entry("runId",                  Channels.base(() -> "")),
        Map.entry("currentTask",            Channels.base(() -> "")),
        Map.entry("currentTaskDeadline",    Channels.base(() -> 0L)),
        Map.entry("currentTaskSize",        Channels.base(() -> 1.0)),
        Map.entry("completedTasks",         Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("cycleCount",             Channels.base(() -> 0)),
        Map.entry("next",                   Channels.base(() -> "")),
        Map.entry("pendingRoute",           Channels.base(() -> "")),
        Map.entry("stopped",                Channels.base(() -> false)),
        Map.entry("gradedTeams",            Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("teamResults",            Channels.base((Supplier<Map<String, String>>) Map::of)),

        // ── Performance tracking ─────────────────────────────────────
        Map.entry("metrics",                Channels.base((Supplier<List<TaskExecutionRecord>>) List::of)),
        Map.entry("agentPerformances",      Channels.base((Supplier<Map<String, AgentPerformanceRecord>>) Map::of)),
        Map.entry("lowQualityCounts",       Channels.base((Supplier<Map<String, Integer>>) Map::of)),
        Map.entry("missedDeadlinesCount",   Channels.base(() -> 0)),
        Map.entry("performanceTargets",     Channels.base((Supplier<List<PerformanceTarget>>) List::of)),
        Map.entry("evaluationSnapshots",    Channels.base((Supplier<List<EvaluationSnapshot>>) List::of)),
        Map.entry("reviewScores",           Channels.base((Supplier<Map<String, Double>>) Map::of)),
        Map.entry("reviewComments",         Channels.base((Supplier<Map<String, String>>) Map::of)),
        Map.entry("supervisorFeedback",     Channels.base((Supplier<Map<String, List<String>>>) Map::of)),

        // ── Resources ────────────────────────────────────────────────
        Map.entry("teamResources",          Channels.base((Supplier<Map<String, ResourceConfig>>) Map::of)),
        Map.entry("resourceChangeRequests", Channels.base((Supplier<List<ResourceChangeRequest>>) List::of)),
        Map.entry("resourceChangeHistory",  Channels.base((Supplier<List<AppliedResourceChange>>) List::of)),

        // ── Improvement ──────────────────────────────────────────────
        Map.entry("issuesIdentified",       Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("fixesImplemented",       Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("codeChanges",            Channels.base((Supplier<List<CodeChange>>) List::of)),
        Map.entry("improvedAt",             Channels.base((Supplier<Map<String, Integer>>) Map::of)),
        Map.entry("escalationCount",        Channels.base(() -> 0)),

        // ── Appender channels ────────────────────────────────────────
        Map.entry(MESSAGES,                 Channels.appender(ArrayList::new))
    );

    public RunState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Returns a new snapshot with {@code updates} applied using the same
     * rules as the graph channels.
     */
    public RunState apply(Map<String, Object> updates) {
        return new RunState(StateUpdates.combine(data(), updates));
    }

    // ── Run and task ─────────────────────────────────────────────────

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String currentTask() {
        return this.<String>value("currentTask").orElse("");
    }

    public boolean hasCurrentTask() {
        return !currentTask().isBlank();
    }

    /** Deadline of the current task, empty when none is set. */
    public Optional<Instant> currentTaskDeadline() {
        long millis = this.<Number>value("currentTaskDeadline").map(Number::longValue).orElse(0L);
        return millis <= 0 ? Optional.empty() : Optional.of(Instant.ofEpochMilli(millis));
    }

    public double currentTaskSize() {
        return this.<Number>value("currentTaskSize").map(Number::doubleValue).orElse(1.0);
    }

    public List<String> completedTasks() {
        return this.<List<String>>value("completedTasks").orElse(List.of());
    }

    public int cycleCount() {
        return this.<Number>value("cycleCount").map(Number::intValue).orElse(0);
    }

    public String next() {
        return this.<String>value("next").orElse("");
    }

    public String pendingRoute() {
        return this.<String>value("pendingRoute").orElse("");
    }

    public boolean stopped() {
        return this.<Boolean>value("stopped").orElse(false);
    }

    public List<String> gradedTeams() {
        return this.<List<String>>value("gradedTeams").orElse(List.of());
    }

    public Map<String, String> teamResults() {
        return this.<Map<String, String>>value("teamResults").orElse(Map.of());
    }

    // ── Performance tracking ─────────────────────────────────────────

    public List<TaskExecutionRecord> metrics() {
        return this.<List<TaskExecutionRecord>>value("metrics").orElse(List.of());
    }

    public Map<String, AgentPerformanceRecord> agentPerformances() {
        return this.<Map<String, AgentPerformanceRecord>>value("agentPerformances").orElse(Map.of());
    }

    public AgentPerformanceRecord agentPerformance(String team) {
        return agentPerformances().getOrDefault(team, AgentPerformanceRecord.empty(team));
    }

    public Map<String, Integer> lowQualityCounts() {
        return this.<Map<String, Integer>>value("lowQualityCounts").orElse(Map.of());
    }

    public int lowQualityCount(String team) {
        return lowQualityCounts().getOrDefault(team, 0);
    }

    public int missedDeadlinesCount() {
        return this.<Number>value("missedDeadlinesCount").map(Number::intValue).orElse(0);
    }

    public List<PerformanceTarget> performanceTargets() {
        return this.<List<PerformanceTarget>>value("performanceTargets").orElse(List.of());
    }

    public List<EvaluationSnapshot> evaluationSnapshots() {
        return this.<List<EvaluationSnapshot>>value("evaluationSnapshots").orElse(List.of());
    }

    public Map<String, Double> reviewScores() {
        return this.<Map<String, Double>>value("reviewScores").orElse(Map.of());
    }

    public Map<String, String> reviewComments() {
        return this.<Map<String, String>>value("reviewComments").orElse(Map.of());
    }

    /** Grader comments per team, oldest first. */
    public Map<String, List<String>> supervisorFeedback() {
        return this.<Map<String, List<String>>>value("supervisorFeedback").orElse(Map.of());
    }

    // ── Resources ────────────────────────────────────────────────────

    public Map<String, ResourceConfig> teamResources() {
        return this.<Map<String, ResourceConfig>>value("teamResources").orElse(Map.of());
    }

    public List<ResourceChangeRequest> resourceChangeRequests() {
        return this.<List<ResourceChangeRequest>>value("resourceChangeRequests").orElse(List.of());
    }

    public List<AppliedResourceChange> resourceChangeHistory() {
        return this.<List<AppliedResourceChange>>value("resourceChangeHistory").orElse(List.of());
    }

    /** Agents currently allocated to {@code team}, 1 when the team has no resource config. */
    public int agentCount(String team) {
        var config = teamResources().get(team);
        return config == null ? 1 : config.currentAgents();
    }

    // ── Improvement ──────────────────────────────────────────────────

    public List<String> issuesIdentified() {
        return this.<List<String>>value("issuesIdentified").orElse(List.of());
    }

    public List<String> fixesImplemented() {
        return this.<List<String>>value("fixesImplemented").orElse(List.of());
    }

    public List<CodeChange> codeChanges() {
        return this.<List<CodeChange>>value("codeChanges").orElse(List.of());
    }

    /** Attempt count per team at the time of its last completed improvement cycle. */
    public Map<String, Integer> improvedAt() {
        return this.<Map<String, Integer>>value("improvedAt").orElse(Map.of());
    }

    public int escalationCount() {
        return this.<Number>value("escalationCount").map(Number::intValue).orElse(0);
    }

    // ── Appender channels ────────────────────────────────────────────

    public List<RunMessage> messages() {
        return this.<List<RunMessage>>value(MESSAGES).orElse(List.of());
    }
}
