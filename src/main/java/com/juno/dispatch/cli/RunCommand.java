package com.juno.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.juno.core.config.JunoConfigurationException;
import com.juno.core.config.JunoProperties;
import com.juno.core.engine.RunEngine;
import com.juno.core.evaluation.SystemEvaluationEngine;
import com.juno.core.events.EventBus;
import com.juno.core.events.JunoEventType;
import com.juno.core.state.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: juno run ["&lt;task&gt;"]
 * <p>
 * Runs the agent teams until the cycle limit is reached or no further task
 * is available, streams run events, and prints the summary and the system
 * report. Exits 1 on a configuration error or a failed run.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the agent teams")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Initial task; generated when omitted")
    private String task;

    @Option(names = "--max-cycles", description = "Maximum number of cycles")
    private Integer maxCycles;

    @Option(names = "--no-auto-generate", description = "Do not generate further tasks")
    private boolean noAutoGenerate;

    @Option(names = "--teams", split = ",", description = "Enabled teams, e.g. research,writing,juno")
    private List<String> teams;

    @Option(names = "--working-dir", description = "Working directory for team documents")
    private String workingDir;

    @Option(names = "--report", description = "Write the system report as JSON to this file")
    private Path reportFile;

    @Option(names = {"--verbose", "-v"}, description = "Show every run event")
    private boolean verbose;

    private final RunEngine runEngine;
    private final SystemEvaluationEngine evaluationEngine;
    private final JunoProperties properties;
    private final EventBus eventBus;

    public RunCommand(RunEngine runEngine, SystemEvaluationEngine evaluationEngine, JunoProperties properties,
                      EventBus eventBus) {
        this.runEngine = runEngine;
        this.evaluationEngine = evaluationEngine;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        applyOverrides();
        try {
            properties.validate();
        } catch (JunoConfigurationException e) {
            ConsoleOutput.error("Configuration error: " + e.getMessage());
            return 1;
        }

        String runId = runEngine.generateRunId();
        ConsoleOutput.info("Starting run " + runId + " with teams " + String.join(", ", properties.getEnabledTeams()));
        var subscription = verbose
                ? eventBus.subscribe(runId, ConsoleOutput::watchEvent)
                : eventBus.subscribe(runId, keyEvents(), ConsoleOutput::watchEvent);
        RunState state;
        try {
            state = runEngine.run(runId, task);
        } catch (JunoConfigurationException e) {
            ConsoleOutput.error("Configuration error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + CliRunner.rootMessage(e));
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.runSummary(state);
        var report = evaluationEngine.generateReport(state);
        ConsoleOutput.report(report);

        if (reportFile != null) {
            try {
                Files.writeString(reportFile, evaluationEngine.toJson(report), StandardCharsets.UTF_8);
                ConsoleOutput.success("Report written to " + reportFile);
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not serialize report: " + e.getOriginalMessage());
                return 1;
            } catch (IOException e) {
                ConsoleOutput.error("Could not write report to " + reportFile + ": " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private void applyOverrides() {
        if (maxCycles != null) {
            properties.setMaxCycles(maxCycles);
        }
        if (noAutoGenerate) {
            properties.setAutoGenerateTasks(false);
        }
        if (teams != null && !teams.isEmpty()) {
            properties.setEnabledTeams(new ArrayList<>(teams.stream().map(String::trim).toList()));
        }
        if (workingDir != null && !workingDir.isBlank()) {
            properties.setWorkingDirectory(workingDir);
        }
    }

    static Set<JunoEventType> keyEvents() {
        return Arrays.stream(JunoEventType.values())
                .filter(JunoEventType::isKey)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(JunoEventType.class)));
    }
}
