package com.juno.core.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.juno.core.model.AppliedResourceChange;
import com.juno.core.model.CodeChange;
import com.juno.core.model.EvaluationSnapshot;
import com.juno.core.model.PerformanceTarget;
import com.juno.core.model.TaskExecutionRecord;
import com.juno.core.model.TeamPerformance;
import com.juno.core.oracle.Oracle;
import com.juno.core.scaling.ResourceScalingEvaluator;
import com.juno.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Periodic roll-ups over a run: task performance against targets, the
 * impact of code changes, the effect of resource scaling, and a combined
 * report with a model-written analysis.
 */
@Service
public class SystemEvaluationEngine {

    private static final Logger log = LoggerFactory.getLogger(SystemEvaluationEngine.class);

    public static final String NARRATIVE_FALLBACK = "Analysis error: Could not parse LLM output.";

    static final double SUCCESS_WEIGHT = 0.25;
    static final double QUALITY_WEIGHT = 0.35;
    static final double DEADLINE_WEIGHT = 0.4;

    private final ResourceScalingEvaluator scalingEvaluator;
    private final Oracle oracle;
    private final Clock clock;
    private final ObjectMapper mapper;

    public SystemEvaluationEngine(ResourceScalingEvaluator scalingEvaluator, Oracle oracle, Clock clock) {
        this.scalingEvaluator = scalingEvaluator;
        this.oracle = oracle;
        this.clock = clock;
        this.mapper = reportMapper();
    }

    /** Mapper used for report JSON, with ISO timestamps. */
    public static ObjectMapper reportMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public TaskPerformanceReport evaluateTaskPerformance(RunState state) {
        var metrics = state.metrics();
        if (metrics.isEmpty()) {
            return TaskPerformanceReport.insufficientData();
        }
        int total = metrics.size();
        double successRate = metrics.stream().filter(TaskExecutionRecord::success).count() / (double) total;
        double avgQuality = metrics.stream().mapToDouble(TaskExecutionRecord::quality).average().orElse(0.0);
        double deadlineMetRate = metrics.stream().filter(TaskExecutionRecord::deadlineMet).count() / (double) total;
        double avgTaskSize = metrics.stream().mapToDouble(TaskExecutionRecord::taskSize).average().orElse(1.0);
        double avgDuration = metrics.stream().mapToDouble(TaskExecutionRecord::durationSeconds).average().orElse(0.0);
        double overall = overallScore(successRate, avgQuality, deadlineMetRate);

        var teams = new TreeMap<String, TeamPerformance>();
        metrics.stream().map(TaskExecutionRecord::teamName).distinct().forEach(team ->
                teams.put(team, scalingEvaluator.summarize(metrics.stream()
                        .filter(m -> m.teamName().equals(team)).toList())));

        var targets = state.performanceTargets().stream()
                .map(t -> {
                    double current = currentValue(t.metricName(), successRate, avgQuality, avgDuration, deadlineMetRate);
                    boolean achieved = current >= t.targetValue();
                    return new TargetAssessment(t.metricName(), t.targetValue(), current, achieved,
                            achieved ? 0.0 : t.targetValue() - current);
                })
                .toList();

        return new TaskPerformanceReport(true, total, successRate, avgQuality, avgDuration, deadlineMetRate,
                avgTaskSize, overall, Map.copyOf(teams), targets,
                String.format(Locale.ROOT, "Overall system performance score: %.2f/1.0", overall));
    }

    static double overallScore(double successRate, double avgQuality, double deadlineMetRate) {
        return SUCCESS_WEIGHT * successRate + QUALITY_WEIGHT * avgQuality + DEADLINE_WEIGHT * deadlineMetRate;
    }

    /**
     * Measured value for a target metric name. Names with no measurement score 0.
     */
    static double currentValue(String metric, double successRate, double avgQuality,
                               double avgDuration, double deadlineMetRate) {
        return switch (metric) {
            case "success_rate", "task_completion_rate" -> successRate;
            case "response_quality", "avg_quality" -> avgQuality;
            case "avg_response_time", "avg_duration" -> avgDuration;
            case "deadline_met_rate" -> deadlineMetRate;
            default -> 0.0;
        };
    }

    /** Targets with their current values refreshed from the task records. */
    public List<PerformanceTarget> refreshTargets(RunState state) {
        var report = evaluateTaskPerformance(state);
        if (!report.sufficientData()) {
            return state.performanceTargets();
        }
        return state.performanceTargets().stream()
                .map(t -> t.withCurrentValue(currentValue(t.metricName(), report.successRate(),
                        report.avgQuality(), report.avgDurationSeconds(), report.deadlineMetRate())))
                .toList();
    }

    public EvaluationSnapshot snapshot(RunState state) {
        var report = evaluateTaskPerformance(state);
        String id = "eval-" + (state.evaluationSnapshots().size() + 1);
        return new EvaluationSnapshot(id, clock.instant(), state.cycleCount(), report.overallScore(),
                report.successRate(), report.avgQuality(), report.deadlineMetRate(),
                report.sufficientData() ? report.avgTaskSize() : 1.0);
    }

    /**
     * Compares current performance with a baseline snapshot: the one named
     * by {@code baselineId}, or the earliest one.
     */
    public CodeImprovementReport evaluateCodeImprovements(RunState state, Optional<String> baselineId) {
        List<CodeChange> changes = state.codeChanges();
        if (changes.isEmpty()) {
            return CodeImprovementReport.noChanges();
        }
        var changeIds = changes.stream()
                .sorted(Comparator.comparing(CodeChange::timestamp))
                .map(CodeChange::changeId)
                .toList();
        int fixes = state.fixesImplemented().size();

        var snapshots = state.evaluationSnapshots();
        Optional<EvaluationSnapshot> baseline = baselineId
                .flatMap(id -> snapshots.stream().filter(s -> s.snapshotId().equals(id)).findFirst())
                .or(() -> snapshots.stream().min(Comparator.comparing(EvaluationSnapshot::takenAt)));
        if (baseline.isEmpty()) {
            return new CodeImprovementReport(changes.size(), fixes, "", Map.of(), 1.0, 0.0, changeIds,
                    "No baseline metrics available for comparison.");
        }
        var base = baseline.get();
        var current = evaluateTaskPerformance(state);

        var deltas = new LinkedHashMap<String, MetricChange>();
        deltas.put("overall_score", change(base.overallScore(), current.overallScore()));
        deltas.put("success_rate", change(base.successRate(), current.successRate()));
        deltas.put("avg_quality", change(base.avgQuality(), current.avgQuality()));
        deltas.put("deadline_met_rate", change(base.deadlineMetRate(), current.deadlineMetRate()));

        double complexity = 1.0;
        double currentSize = current.sufficientData() ? current.avgTaskSize() : 1.0;
        if (base.avgTaskSize() > 0 && currentSize > base.avgTaskSize()) {
            complexity = currentSize / base.avgTaskSize();
        }
        double improvement = deltas.get("overall_score").relativeChange() * complexity;
        return new CodeImprovementReport(changes.size(), fixes, base.snapshotId(), deltas, complexity,
                improvement, changeIds,
                String.format(Locale.ROOT, "Code improvements resulted in %.1f%% performance gain.", improvement * 100.0));
    }

    private static MetricChange change(double baseline, double current) {
        double relative = baseline > 0 ? (current - baseline) / baseline : current;
        return new MetricChange(baseline, current, current - baseline, relative);
    }

    /**
     * For every team with resource history, splits its records at the time
     * of the latest change and measures the efficiency change across it.
     */
    public ResourceScalingReport evaluateResourceScaling(RunState state) {
        var history = state.resourceChangeHistory();
        if (history.isEmpty()) {
            return ResourceScalingReport.none();
        }
        var latestByTeam = new TreeMap<String, AppliedResourceChange>();
        for (AppliedResourceChange change : history) {
            latestByTeam.merge(change.team(), change,
                    (a, b) -> b.appliedAt().isBefore(a.appliedAt()) ? a : b);
        }

        var results = new LinkedHashMap<String, TeamScalingResult>();
        for (var change : latestByTeam.values()) {
            var teamRecords = state.metrics().stream().filter(m -> m.teamName().equals(change.team())).toList();
            var before = scalingEvaluator.summarize(teamRecords.stream()
                    .filter(m -> m.endTime().isBefore(change.appliedAt())).toList());
            var after = scalingEvaluator.summarize(teamRecords.stream()
                    .filter(m -> !m.endTime().isBefore(change.appliedAt())).toList());
            double efficiency = scalingEvaluator.efficiencyChange(before, after, change.oldAgents(), change.newAgents());
            var assessment = scalingEvaluator.assess(change.team(), efficiency);
            results.put(change.team(), new TeamScalingResult(change.team(), change.oldAgents(), change.newAgents(),
                    before, after, efficiency, assessment.narrative()));
        }
        double overall = results.values().stream().mapToDouble(TeamScalingResult::efficiencyChange).average().orElse(0.0);
        return new ResourceScalingReport(Map.copyOf(results), overall,
                String.format(Locale.ROOT, "Resource scaling effectiveness: %.1f%%", overall * 100.0));
    }

    /**
     * Combines the three evaluations with a narrative from the oracle. A
     * failed or empty narrative is replaced by {@link #NARRATIVE_FALLBACK}.
     */
    public SystemReport generateReport(RunState state) {
        var performance = evaluateTaskPerformance(state);
        var code = evaluateCodeImprovements(state, Optional.empty());
        var scaling = evaluateResourceScaling(state);

        String narrative;
        try {
            String summary = mapper.writeValueAsString(Map.of(
                    "taskPerformance", performance,
                    "codeImprovements", code,
                    "resourceScaling", scaling));
            narrative = oracle.synthesizeReport(summary);
            if (narrative == null || narrative.isBlank()) {
                narrative = NARRATIVE_FALLBACK;
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Report narrative unavailable: {}", e.getMessage());
            narrative = NARRATIVE_FALLBACK;
        }
        return new SystemReport(clock.instant(), performance, code, scaling, narrative);
    }

    public String toJson(SystemReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(report);
    }
}
