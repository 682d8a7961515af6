package com.juno.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the performance and resource records.
 */
class ModelTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    // ═══════════════════════════════════════════════════════════════════
    //  TaskExecutionRecord
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("TaskExecutionRecord")
    class TaskExecutionRecordTests {

        @Test
        @DisplayName("no deadline counts as met with zero buffer")
        void noDeadlineIsMet() {
            var record = record(T0, T0.plusSeconds(90), null);
            assertTrue(record.deadlineMet());
            assertEquals(0.0, record.deadlineBufferSeconds());
            assertEquals(90.0, record.durationSeconds(), 1e-9);
        }

        @Test
        @DisplayName("finishing exactly at the deadline meets it")
        void endAtDeadlineIsMet() {
            var record = record(T0, T0.plusSeconds(60), T0.plusSeconds(60));
            assertTrue(record.deadlineMet());
            assertEquals(0.0, record.deadlineBufferSeconds(), 1e-9);
        }

        @Test
        @DisplayName("overrun gives a negative buffer")
        void overrunIsMissed() {
            var record = record(T0, T0.plusSeconds(100), T0.plusSeconds(70));
            assertFalse(record.deadlineMet());
            assertEquals(-30.0, record.deadlineBufferSeconds(), 1e-9);
        }

        @Test
        @DisplayName("early finish gives a positive buffer")
        void earlyFinish() {
            var record = record(T0, T0.plusSeconds(10), T0.plusSeconds(70));
            assertEquals(60.0, record.deadlineBufferSeconds(), 1e-9);
        }

        @Test
        @DisplayName("withQuality clamps into [0, 1] and keeps other fields")
        void withQualityClamps() {
            var record = record(T0, T0.plusSeconds(10), null);
            assertEquals(1.0, record.withQuality(3.0).quality());
            assertEquals(0.0, record.withQuality(-1.0).quality());
            var patched = record.withQuality(0.8);
            assertEquals(0.8, patched.quality());
            assertEquals(record.taskId(), patched.taskId());
            assertEquals(record.agentCount(), patched.agentCount());
        }

        @Test
        @DisplayName("null strings are normalized")
        void nullStrings() {
            var record = new TaskExecutionRecord("t", "research", "a", null, T0, T0, null,
                    true, null, 0.0, 1.0, 0, 1);
            assertEquals("", record.errorMessage());
            assertEquals("", record.description());
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  AgentPerformanceRecord
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("AgentPerformanceRecord")
    class AgentPerformanceRecordTests {

        @Test
        @DisplayName("empty record has zero quality and full success rate")
        void emptyRecord() {
            var record = AgentPerformanceRecord.empty("research");
            assertEquals(0.0, record.avgQuality());
            assertEquals(1.0, record.successRate());
            assertFalse(record.needsImprovement());
        }

        @Test
        @DisplayName("three errors trigger improvement")
        void errorLimit() {
            var record = new AgentPerformanceRecord("research", List.of(), 7, 3, 0.0);
            assertTrue(record.needsImprovement());
        }

        @Test
        @DisplayName("low average quality needs at least three samples")
        void qualityNeedsSamples() {
            var two = new AgentPerformanceRecord("writing", List.of(0.2, 0.3), 2, 0, 0.0);
            var three = new AgentPerformanceRecord("writing", List.of(0.2, 0.3, 0.4), 3, 0, 0.0);
            assertFalse(two.needsImprovement());
            assertTrue(three.needsImprovement());
        }

        @Test
        @DisplayName("low success rate needs at least five attempts")
        void successRateNeedsAttempts() {
            var four = new AgentPerformanceRecord("writing", List.of(0.9, 0.9), 2, 2, 0.0);
            var six = new AgentPerformanceRecord("writing", List.of(0.9, 0.9, 0.9), 4, 2, 0.0);
            assertFalse(four.needsImprovement());
            assertTrue(six.needsImprovement());
        }

        @Test
        @DisplayName("custom policy thresholds are honored")
        void customPolicy() {
            var record = new AgentPerformanceRecord("writing", List.of(0.6, 0.6, 0.6), 3, 0, 0.0);
            assertFalse(record.needsImprovement());
            assertTrue(record.needsImprovement(new ImprovementPolicy(3, 3, 0.7, 5, 0.7)));
        }

        @Test
        @DisplayName("withGrade counts successes and errors")
        void withGrade() {
            var record = AgentPerformanceRecord.empty("research")
                    .withGrade(0.8, true, 12.0)
                    .withGrade(0.0, false, 3.0);
            assertEquals(1, record.successCount());
            assertEquals(1, record.errorCount());
            assertEquals(2, record.totalAttempts());
            assertEquals(0.4, record.avgQuality(), 1e-9);
            assertEquals(15.0, record.totalTimeSeconds(), 1e-9);
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Targets, resources and teams
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Targets and resources")
    class TargetAndResourceTests {

        @Test
        @DisplayName("target is met when current reaches target")
        void targetMet() {
            var target = new PerformanceTarget("success_rate", 0.9, 0.9, "");
            assertTrue(target.isMet());
            assertFalse(target.withCurrentValue(0.89).isMet());
        }

        @Test
        @DisplayName("resource config rejects out-of-range counts")
        void resourceBounds() {
            assertThrows(IllegalArgumentException.class, () -> new ResourceConfig(4, 1, 3, 1.0));
            assertThrows(IllegalArgumentException.class, () -> new ResourceConfig(1, 3, 2, 1.0));
        }

        @Test
        @DisplayName("withAgents clamps to the bounds")
        void withAgentsClamps() {
            var config = new ResourceConfig(1, 1, 3, 1.0);
            assertEquals(3, config.withAgents(7).currentAgents());
            assertEquals(1, config.withAgents(0).currentAgents());
            assertTrue(config.canScaleUp());
            assertFalse(config.withAgents(3).canScaleUp());
        }

        @Test
        @DisplayName("Team.fromId accepts ids and node names")
        void teamFromId() {
            assertEquals(Team.RESEARCH, Team.fromId("research"));
            assertEquals(Team.WRITING, Team.fromId("WRITING_TEAM"));
            assertFalse(Team.JUNO.isWorker());
            assertThrows(IllegalArgumentException.class, () -> Team.fromId("marketing"));
        }
    }

    // ── Helper methods ──────────────────────────────────────────────

    private static TaskExecutionRecord record(Instant start, Instant end, Instant deadline) {
        return new TaskExecutionRecord("task-1", "research", "research_team", "desc", start, end, deadline,
                true, "", 0.5, 1.0, 10, 1);
    }
}
