package com.juno.dispatch.cli;

import com.juno.core.evaluation.SystemReport;
import com.juno.core.events.JunoEvent;
import com.juno.core.model.PerformanceTarget;
import com.juno.core.state.RunState;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Juno CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) JUNO v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [JUNO]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void target(PerformanceTarget target) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "  @|bold %s|@ target %.2f  @|faint %s|@",
                target.metricName(), target.targetValue(), target.description())));
    }

    public static void runSummary(RunState state) {
        long failed = state.metrics().stream().filter(m -> !m.success()).count();
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + state.runId() + "|@"));
        System.out.println("  Cycles: " + state.cycleCount());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Task records: " + state.metrics().size() +
                (failed > 0 ? " (@|fg(red) " + failed + " failed|@)" : "")));
        System.out.println("  Escalations: " + state.escalationCount());
        System.out.println("  Code changes: " + state.codeChanges().size());
        System.out.println("  Resource changes: " + state.resourceChangeHistory().size());
        state.teamResources().forEach((team, config) ->
                System.out.println("    " + team + ": " + config.currentAgents() + " agent(s)"));
    }

    public static void report(SystemReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold System Report|@"));
        System.out.println("  " + report.taskPerformance().summary());
        report.taskPerformance().targets().forEach(t -> {
            String status = t.achieved() ? "@|fg(green) met|@" : "@|fg(red) missed|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                    "    %s %.2f / %.2f ", t.metric(), t.current(), t.target()) + status));
        });
        System.out.println("  " + report.codeImprovements().summary());
        System.out.println("  " + report.resourceScaling().summary());
        System.out.println();
        System.out.println(report.narrative());
    }

    public static void watchEvent(JunoEvent event) {
        String prefix = switch (event.type().category()) {
            case RUN -> "@|fg(cyan) [RUN]|@";
            case TASK -> "@|bold,fg(yellow) [TASK]|@";
            case TEAM -> "@|fg(blue) [TEAM]|@";
            case TEAM_FAILURE -> "@|fg(red) [TEAM]|@";
            case WORKLOAD -> "@|fg(yellow) [WORKLOAD]|@";
            case RESOURCES -> "@|fg(magenta) [RESOURCES]|@";
            case IMPROVEMENT -> "@|fg(green),bold [JUNO]|@";
            case COMPLETE -> "@|fg(green),bold [COMPLETE]|@";
        };
        String team = event.team() == null ? "" : event.team() + " ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.eventType() + " ")
                + team + event.payload());
    }
}
