package com.juno.core.evaluation;

import com.juno.core.model.AppliedResourceChange;
import com.juno.core.model.CodeChange;
import com.juno.core.model.EvaluationSnapshot;
import com.juno.core.model.PerformanceTarget;
import com.juno.core.model.TaskExecutionRecord;
import com.juno.core.oracle.Oracle;
import com.juno.core.scaling.ResourceScalingEvaluator;
import com.juno.core.state.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SystemEvaluationEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private Oracle oracle;
    private SystemEvaluationEngine engine;

    @BeforeEach
    void setUp() {
        oracle = mock(Oracle.class);
        engine = new SystemEvaluationEngine(new ResourceScalingEvaluator(), oracle, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("evaluateTaskPerformance")
    class TaskPerformanceTests {

        @Test
        @DisplayName("an empty metrics log reports insufficient data with no team breakdown")
        void insufficientData() {
            var report = engine.evaluateTaskPerformance(state(Map.of()));

            assertFalse(report.sufficientData());
            assertEquals(TaskPerformanceReport.INSUFFICIENT_DATA, report.summary());
            assertTrue(report.teams().isEmpty());
            assertEquals(0.0, report.overallScore());
        }

        @Test
        @DisplayName("overall score weights success, quality and deadlines")
        void overallScore() {
            var report = engine.evaluateTaskPerformance(state(Map.of("metrics", sampleMetrics())));

            assertTrue(report.sufficientData());
            assertEquals(2, report.totalTasks());
            assertEquals(1.0, report.successRate(), 1e-9);
            assertEquals(0.7, report.avgQuality(), 1e-9);
            assertEquals(1.0, report.deadlineMetRate(), 1e-9);
            assertEquals(0.25 + 0.35 * 0.7 + 0.4, report.overallScore(), 1e-9);
            assertEquals(Set.of("research", "writing"), report.teams().keySet());
            assertTrue(report.summary().startsWith("Overall system performance score: "));
        }

        @Test
        @DisplayName("targets map onto measured values and unknown names score zero")
        void targets() {
            var targets = List.of(
                    new PerformanceTarget("task_completion_rate", 0.9, 0.0, ""),
                    new PerformanceTarget("response_quality", 0.8, 0.0, ""),
                    new PerformanceTarget("customer_delight", 0.5, 0.0, ""));
            var report = engine.evaluateTaskPerformance(state(Map.of(
                    "metrics", sampleMetrics(), "performanceTargets", targets)));

            var completion = report.targets().get(0);
            assertTrue(completion.achieved());
            assertEquals(0.0, completion.gap());

            var quality = report.targets().get(1);
            assertFalse(quality.achieved());
            assertEquals(0.1, quality.gap(), 1e-9);

            var custom = report.targets().get(2);
            assertEquals(0.0, custom.current());
            assertFalse(custom.achieved());
        }

        @Test
        @DisplayName("refreshTargets leaves targets untouched without data")
        void refreshWithoutData() {
            var targets = List.of(new PerformanceTarget("success_rate", 0.9, 0.3, ""));
            assertEquals(targets, engine.refreshTargets(state(Map.of("performanceTargets", targets))));
        }

        @Test
        @DisplayName("refreshTargets fills in measured values")
        void refresh() {
            var targets = List.of(new PerformanceTarget("response_quality", 0.8, 0.0, ""));
            var refreshed = engine.refreshTargets(state(Map.of("metrics", sampleMetrics(), "performanceTargets", targets)));
            assertEquals(0.7, refreshed.get(0).currentValue(), 1e-9);
        }
    }

    @Nested
    @DisplayName("evaluateCodeImprovements")
    class CodeImprovementTests {

        @Test
        @DisplayName("no changes yields the empty report")
        void noChanges() {
            assertEquals(CodeImprovementReport.noChanges(), engine.evaluateCodeImprovements(state(Map.of()), Optional.empty()));
        }

        @Test
        @DisplayName("changes without a snapshot report no baseline")
        void noBaseline() {
            var report = engine.evaluateCodeImprovements(state(Map.of("codeChanges", List.of(change("change-1")))),
                    Optional.empty());
            assertEquals(1, report.codeChangeCount());
            assertEquals("No baseline metrics available for comparison.", report.summary());
        }

        @Test
        @DisplayName("improvement is measured against the earliest snapshot")
        void againstEarliestSnapshot() {
            var early = new EvaluationSnapshot("eval-1", NOW.minusSeconds(600), 1, 0.5, 1.0, 0.5, 0.5, 1.0);
            var later = new EvaluationSnapshot("eval-2", NOW.minusSeconds(60), 2, 0.8, 1.0, 0.7, 1.0, 1.0);
            var state = state(Map.of(
                    "metrics", sampleMetrics(),
                    "codeChanges", List.of(change("change-2"), change("change-1")),
                    "evaluationSnapshots", List.of(later, early),
                    "fixesImplemented", List.of("fix a")));

            var report = engine.evaluateCodeImprovements(state, Optional.empty());

            assertEquals("eval-1", report.baselineId());
            assertEquals(1, report.fixesImplemented());
            assertEquals(1.0, report.complexityFactor());
            double expected = (0.895 - 0.5) / 0.5;
            assertEquals(expected, report.overallImprovement(), 1e-9);
            assertEquals(0.2, report.changes().get("avg_quality").absoluteChange(), 1e-9);

            var named = engine.evaluateCodeImprovements(state, Optional.of("eval-2"));
            assertEquals("eval-2", named.baselineId());
        }
    }

    @Test
    @DisplayName("resource scaling compares records on each side of the latest change")
    void resourceScaling() {
        var metrics = List.of(
                record("research", NOW.minusSeconds(100), 0.6),
                record("research", NOW.plusSeconds(100), 0.6));
        var history = List.of(
                new AppliedResourceChange("research", 1, 2, "load", NOW),
                new AppliedResourceChange("research", 1, 1, "older", NOW.minusSeconds(3600)));

        var report = engine.evaluateResourceScaling(state(Map.of("metrics", metrics, "resourceChangeHistory", history)));

        var research = report.teams().get("research");
        assertEquals(2, research.newAgents());
        assertEquals(-0.5, research.efficiencyChange(), 1e-9);
        assertEquals(-0.5, report.overallEffectiveness(), 1e-9);
        assertEquals("Resource scaling effectiveness: -50.0%", report.summary());

        assertEquals(ResourceScalingReport.none(), engine.evaluateResourceScaling(state(Map.of())));
    }

    @Nested
    @DisplayName("generateReport")
    class ReportTests {

        @Test
        @DisplayName("the oracle writes the narrative")
        void narrative() throws Exception {
            when(oracle.synthesizeReport(anyString())).thenReturn("All good.");

            var report = engine.generateReport(state(Map.of("metrics", sampleMetrics())));

            assertEquals("All good.", report.narrative());
            assertEquals(NOW, report.generatedAt());
            assertTrue(engine.toJson(report).contains("\"narrative\" : \"All good.\""));
        }

        @Test
        @DisplayName("an empty or failed narrative uses the fallback")
        void fallback() {
            when(oracle.synthesizeReport(anyString())).thenReturn("  ");
            assertEquals(SystemEvaluationEngine.NARRATIVE_FALLBACK, engine.generateReport(state(Map.of())).narrative());

            when(oracle.synthesizeReport(anyString())).thenThrow(new IllegalStateException("down"));
            assertEquals(SystemEvaluationEngine.NARRATIVE_FALLBACK, engine.generateReport(state(Map.of())).narrative());
        }
    }

    @Test
    @DisplayName("snapshots are numbered and default the task size without data")
    void snapshot() {
        var snapshot = engine.snapshot(state(Map.of("cycleCount", 3)));
        assertEquals("eval-1", snapshot.snapshotId());
        assertEquals(3, snapshot.cycle());
        assertEquals(1.0, snapshot.avgTaskSize());
        assertEquals(NOW, snapshot.takenAt());
    }

    // ── Helper methods ──────────────────────────────────────────────

    private static RunState state(Map<String, Object> data) {
        return new RunState(new HashMap<>(data));
    }

    private static List<TaskExecutionRecord> sampleMetrics() {
        return List.of(
                new TaskExecutionRecord("t-1", "research", "research_team", "task", NOW.minusSeconds(120),
                        NOW.minusSeconds(60), null, true, "", 0.8, 1.0, 100, 1),
                new TaskExecutionRecord("t-1", "writing", "writing_team", "task", NOW.minusSeconds(60),
                        NOW, NOW.plusSeconds(60), true, "", 0.6, 1.0, 100, 1));
    }

    private static TaskExecutionRecord record(String team, Instant end, double quality) {
        return new TaskExecutionRecord("t", team, team + "_team", "task", end.minusSeconds(30), end, null,
                true, "", quality, 1.0, 10, 1);
    }

    private static CodeChange change(String id) {
        return new CodeChange(id, 1, "fix", "print(1)", List.of("issue"), NOW.minusSeconds(30));
    }
}
