package com.juno.core.engine;

import com.juno.core.config.JunoProperties;
import com.juno.core.events.EventBus;
import com.juno.core.events.JunoEvent;
import com.juno.core.events.JunoEventType;
import com.juno.core.graph.JunoGraph;
import com.juno.core.logging.MdcContext;
import com.juno.core.metrics.JunoMetrics;
import com.juno.core.model.ResourceConfig;
import com.juno.core.model.RunMessage;
import com.juno.core.model.Team;
import com.juno.core.state.RunState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the Juno workflow: validates the configuration, builds the initial
 * run state and invokes the compiled graph until it finishes.
 */
@Service
public class RunEngine {

    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final JunoGraph junoGraph;
    private final JunoProperties properties;
    private final EventBus eventBus;
    private final JunoMetrics metrics;
    private final Clock clock;

    public RunEngine(JunoGraph junoGraph, JunoProperties properties, EventBus eventBus, JunoMetrics metrics,
                     Clock clock) {
        this.junoGraph = junoGraph;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RunState run(String initialTask) {
        return run(generateRunId(), initialTask);
    }

    /**
     * @param initialTask first task, or {@code null} to start with a generated one
     * @return the final run state
     * @throws com.juno.core.config.JunoConfigurationException when the configuration is invalid
     * @throws IllegalStateException when the graph returns no state
     */
    public RunState run(String runId, String initialTask) {
        properties.validate();
        MdcContext.setRun(runId);
        try {
            boolean hasTask = initialTask != null && !initialTask.isBlank();
            log.info("Starting run {} with teams {} and max {} cycle(s)", runId, properties.getEnabledTeams(),
                    properties.getMaxCycles());
            eventBus.publish(JunoEvent.of(JunoEventType.RUN_STARTED, runId, null,
                    Map.of("teams", List.copyOf(properties.getEnabledTeams()), "initialTask", hasTask)));

            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();
            RunState state;
            try {
                state = junoGraph.compileForRun()
                        .invoke(initialState(runId, hasTask ? initialTask.strip() : null), config)
                        .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for run " + runId));
            } catch (RuntimeException e) {
                metrics.recordRunResult("failed");
                eventBus.publish(JunoEvent.of(JunoEventType.RUN_COMPLETED, runId, null,
                        Map.of("outcome", "failed", "error", String.valueOf(e.getMessage()))));
                throw e;
            }

            metrics.recordRunResult("completed");
            eventBus.publish(JunoEvent.of(JunoEventType.RUN_COMPLETED, runId, null,
                    Map.of("outcome", "completed", "cycles", state.cycleCount(), "records", state.metrics().size())));
            log.info("Run {} completed after {} cycle(s), {} task record(s)", runId, state.cycleCount(),
                    state.metrics().size());
            return state;
        } finally {
            MdcContext.clear();
        }
    }

    Map<String, Object> initialState(String runId, String initialTask) {
        var resources = new HashMap<String, ResourceConfig>();
        var bounds = properties.getResources();
        for (Team team : properties.teams()) {
            resources.put(team.id(), new ResourceConfig(bounds.getInitialAgents(), bounds.getMinAgents(),
                    bounds.getMaxAgents(), bounds.getScalingFactor()));
        }
        var state = new HashMap<String, Object>();
        state.put("runId", runId);
        state.put("teamResources", Map.copyOf(resources));
        state.put("performanceTargets", properties.initialTargets());
        if (initialTask != null) {
            state.put("currentTask", initialTask);
            state.put("cycleCount", 1);
            state.put(RunState.MESSAGES, List.of(new RunMessage("user", initialTask)));
        }
        return Map.copyOf(state);
    }

    /**
     * Generates a run ID in the format JUNO-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("JUNO-%d-%04d", year, count);
    }
}
