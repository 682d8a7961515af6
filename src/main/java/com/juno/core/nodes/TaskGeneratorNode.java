package com.juno.core.nodes;

import com.juno.core.config.JunoProperties;
import com.juno.core.evaluation.SystemEvaluationEngine;
import com.juno.core.events.EventBus;
import com.juno.core.events.JunoEvent;
import com.juno.core.events.JunoEventType;
import com.juno.core.logging.MdcContext;
import com.juno.core.model.RunMessage;
import com.juno.core.model.Team;
import com.juno.core.oracle.Oracle;
import com.juno.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Starts a new cycle: generates a task in a random configured category and
 * resets the per-task fields. With task generation off it stops the run.
 */
@Component
public class TaskGeneratorNode {

    private static final Logger log = LoggerFactory.getLogger(TaskGeneratorNode.class);

    public static final String NAME = "task_generator";

    private final Oracle oracle;
    private final SystemEvaluationEngine evaluationEngine;
    private final JunoProperties properties;
    private final EventBus eventBus;
    private final Random random;

    @Autowired
    public TaskGeneratorNode(Oracle oracle, SystemEvaluationEngine evaluationEngine, JunoProperties properties,
                             EventBus eventBus) {
        this(oracle, evaluationEngine, properties, eventBus, new Random());
    }

    public TaskGeneratorNode(Oracle oracle, SystemEvaluationEngine evaluationEngine, JunoProperties properties,
                             EventBus eventBus, Random random) {
        this.oracle = oracle;
        this.evaluationEngine = evaluationEngine;
        this.properties = properties;
        this.eventBus = eventBus;
        this.random = random;
    }

    public Map<String, Object> apply(RunState state) {
        if (!properties.isAutoGenerateTasks()) {
            log.info("Task generation is off, stopping");
            return Map.of("stopped", true);
        }
        var categories = properties.getTaskCategories();
        String category = categories.get(random.nextInt(categories.size()));
        String task = generate(category);
        int cycle = state.cycleCount() + 1;
        MdcContext.setCycle(state.runId(), cycle);
        log.info("Cycle {} task ({}): {}", cycle, category, task);

        var completed = new ArrayList<>(state.completedTasks());
        if (state.hasCurrentTask()) {
            completed.add(state.currentTask());
        }

        var update = new HashMap<String, Object>();
        update.put("currentTask", task);
        update.put("cycleCount", cycle);
        update.put("completedTasks", List.copyOf(completed));
        update.put("currentTaskDeadline", 0L);
        update.put("currentTaskSize", 1.0);
        update.put("gradedTeams", List.of());
        update.put("teamResults", Map.of());
        update.put("performanceTargets", state.performanceTargets().isEmpty()
                ? properties.initialTargets()
                : evaluationEngine.refreshTargets(state));
        int frequency = Math.max(1, properties.getImprovement().getEvaluationFrequency());
        if (cycle % frequency == 0) {
            var snapshots = new ArrayList<>(state.evaluationSnapshots());
            snapshots.add(evaluationEngine.snapshot(state));
            update.put("evaluationSnapshots", List.copyOf(snapshots));
        }
        update.put("pendingRoute", properties.workerTeams().stream()
                .findFirst()
                .map(Team::nodeName)
                .orElse(""));
        update.put(RunState.MESSAGES, List.of(new RunMessage(NAME,
                "New task (cycle " + cycle + ", " + category + "): " + task)));

        eventBus.publish(JunoEvent.of(JunoEventType.TASK_GENERATED, state.runId(), null,
                Map.of("cycle", cycle, "category", category, "task", task)));
        return update;
    }

    private String generate(String category) {
        try {
            var generated = oracle.generateTask(category);
            if (generated != null && generated.task() != null && !generated.task().isBlank()) {
                return generated.task().strip();
            }
            log.warn("Task generation for '{}' returned nothing, using fallback", category);
        } catch (RuntimeException e) {
            log.warn("Task generation for '{}' failed, using fallback: {}", category, e.getMessage());
        }
        return fallbackTask(category);
    }

    static String fallbackTask(String category) {
        return category + ": produce a short report on a topic of your choice.";
    }
}
