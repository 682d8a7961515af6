package com.juno.dispatch.cli;

import com.juno.core.config.JunoProperties;
import com.juno.core.engine.RunEngine;
import com.juno.core.evaluation.SystemEvaluationEngine;
import com.juno.core.events.EventBus;
import com.juno.core.events.JunoEvent;
import com.juno.core.events.JunoEventType;
import com.juno.core.oracle.Oracle;
import com.juno.core.scaling.ResourceScalingEvaluator;
import com.juno.core.state.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the Juno CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private static final String RUN_ID = "JUNO-2026-0001";

    private record CliResult(int exitCode, String output) {}

    private RunEngine runEngine;
    private Oracle oracle;
    private JunoProperties properties;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        runEngine = mock(RunEngine.class);
        oracle = mock(Oracle.class);
        properties = new JunoProperties();
        eventBus = new EventBus();
        when(runEngine.generateRunId()).thenReturn(RUN_ID);
        when(oracle.synthesizeReport(anyString())).thenReturn("The teams improved steadily.");
    }

    @Nested
    @DisplayName("help and version")
    class HelpAndVersion {

        @Test
        @DisplayName("--help lists the subcommands")
        void help() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("targets"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Juno 0.1.0"));
        }
    }

    @Test
    @DisplayName("targets prints every configured metric")
    void targets() {
        CliResult result = execute("targets");

        assertEquals(0, result.exitCode());
        for (String metric : List.of("avg_response_time", "success_rate", "response_quality", "task_completion_rate")) {
            assertTrue(result.output().contains(metric), metric);
        }
    }

    @Test
    @DisplayName("an exception escaping a command exits 1 with a one-line error")
    void commandException() {
        properties = spy(new JunoProperties());
        doThrow(new IllegalStateException("targets", new IllegalArgumentException("bad target value")))
                .when(properties).initialTargets();

        CliResult result = execute("targets");

        assertEquals(CliRunner.EXIT_FAILURE, result.exitCode());
        assertTrue(result.output().contains("targets failed: bad target value"));
        assertFalse(result.output().contains("at com.juno"));
    }

    @Test
    @DisplayName("rootMessage falls back to the exception type when there is no message")
    void rootMessage() {
        assertEquals("inner", CliRunner.rootMessage(new RuntimeException("outer", new IllegalStateException("inner"))));
        assertEquals("NullPointerException", CliRunner.rootMessage(new NullPointerException()));
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("a completed run prints the summary and the report narrative")
        void completed() {
            when(runEngine.run(eq(RUN_ID), any())).thenReturn(finalState());

            CliResult result = execute("run", "Write about tides");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Run " + RUN_ID));
            assertTrue(result.output().contains("Cycles: 2"));
            assertTrue(result.output().contains("The teams improved steadily."));
            verify(runEngine).run(RUN_ID, "Write about tides");
        }

        @Test
        @DisplayName("options override the configuration before the run starts")
        void overrides() {
            when(runEngine.run(eq(RUN_ID), any())).thenReturn(finalState());

            CliResult result = execute("run", "--max-cycles", "3", "--no-auto-generate",
                    "--teams", "research, juno", "--working-dir", "/tmp/juno-docs");

            assertEquals(0, result.exitCode());
            assertEquals(3, properties.getMaxCycles());
            assertFalse(properties.isAutoGenerateTasks());
            assertEquals(List.of("research", "juno"), properties.getEnabledTeams());
            assertEquals("/tmp/juno-docs", properties.getWorkingDirectory());
            verify(runEngine).run(RUN_ID, null);
        }

        @Test
        @DisplayName("an invalid override exits 1 without running")
        void invalidConfiguration() {
            CliResult result = execute("run", "--teams", "juno");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Configuration error"));
            verify(runEngine, never()).run(anyString(), any());
        }

        @Test
        @DisplayName("a failed run exits 1 with the root cause")
        void failed() {
            when(runEngine.run(eq(RUN_ID), any()))
                    .thenThrow(new IllegalStateException("graph", new RuntimeException("model unavailable")));

            CliResult result = execute("run", "task");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Run failed: model unavailable"));
        }

        @Test
        @DisplayName("key events are streamed while the run is in progress")
        void streamsEvents() {
            when(runEngine.run(eq(RUN_ID), any())).thenAnswer(invocation -> {
                eventBus.publish(JunoEvent.of(JunoEventType.TEAM_GRADED, RUN_ID, "writing", Map.of("score", 0.4)));
                eventBus.publish(JunoEvent.of(JunoEventType.DEADLINE_ASSIGNED, RUN_ID, "writing", Map.of()));
                return finalState();
            });

            CliResult result = execute("run", "task");

            assertTrue(result.output().contains("team.graded writing"));
            assertFalse(result.output().contains("deadline.assigned"));
        }

        @Test
        @DisplayName("--report writes the system report as JSON")
        void report(@TempDir Path dir) throws Exception {
            when(runEngine.run(eq(RUN_ID), any())).thenReturn(finalState());
            Path file = dir.resolve("report.json");

            CliResult result = execute("run", "task", "--report", file.toString());

            assertEquals(0, result.exitCode());
            String json = Files.readString(file);
            assertTrue(json.contains("\"narrative\" : \"The teams improved steadily.\""));
            assertTrue(json.contains("taskPerformance"));
        }
    }

    // ── Helper methods ───────────────────────────────────────────────

    private RunState finalState() {
        var data = new HashMap<String, Object>();
        data.put("runId", RUN_ID);
        data.put("cycleCount", 2);
        return new RunState(data);
    }

    private CommandLine.IFactory createFactory() {
        var evaluationEngine = new SystemEvaluationEngine(new ResourceScalingEvaluator(), oracle,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(runEngine, evaluationEngine, properties, eventBus);
                }
                if (cls == TargetsCommand.class) {
                    return (K) new TargetsCommand(properties);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var runner = new CliRunner(new JunoCommand(), createFactory());
            runner.run(args);
            capturePrintStream.flush();
            return new CliResult(runner.getExitCode(), capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }
}
