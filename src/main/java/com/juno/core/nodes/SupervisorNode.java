package com.juno.core.nodes;

import com.juno.core.config.JunoProperties;
import com.juno.core.metrics.JunoMetrics;
import com.juno.core.model.RunMessage;
import com.juno.core.model.Team;
import com.juno.core.oracle.Oracle;
import com.juno.core.router.HubAndSpoke;
import com.juno.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level supervisor. Decides the next node from the run state; the
 * oracle is consulted only to order the worker teams within a cycle.
 * <ol>
 *   <li>stopped run: finish</li>
 *   <li>no current task: generate one, or finish when generation is off</li>
 *   <li>pending route (escalation or first team of a new task): take it</li>
 *   <li>a team needing improvement since its last improvement cycle: juno team</li>
 *   <li>every worker team graded: finish at the cycle limit, else generate the next task</li>
 *   <li>otherwise: the oracle picks among the ungraded worker teams</li>
 * </ol>
 */
@Component
public class SupervisorNode {

    private static final Logger log = LoggerFactory.getLogger(SupervisorNode.class);

    public static final String NAME = "supervisor";

    private final Oracle oracle;
    private final JunoProperties properties;
    private final JunoMetrics metrics;

    public SupervisorNode(Oracle oracle, JunoProperties properties, JunoMetrics metrics) {
        this.oracle = oracle;
        this.properties = properties;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(RunState state) {
        if (state.stopped()) {
            return route(HubAndSpoke.FINISH);
        }
        if (!state.hasCurrentTask()) {
            return route(properties.isAutoGenerateTasks() ? TaskGeneratorNode.NAME : HubAndSpoke.FINISH);
        }
        if (!state.pendingRoute().isBlank()) {
            String pending = state.pendingRoute();
            if (Team.JUNO.nodeName().equals(pending) && !properties.isJunoEnabled()) {
                log.info("Improvement requested but the juno team is disabled");
            } else {
                log.info("Taking pending route to {}", pending);
                return Map.of("next", pending, "pendingRoute", "");
            }
        }
        if (properties.isJunoEnabled()) {
            Optional<Team> lagging = teamNeedingImprovement(state);
            if (lagging.isPresent()) {
                log.info("Team {} needs improvement, routing to the juno team", lagging.get().id());
                return Map.of("next", Team.JUNO.nodeName(), "pendingRoute", "");
            }
        }

        List<String> ungraded = properties.workerTeams().stream()
                .filter(t -> !state.gradedTeams().contains(t.id()))
                .map(Team::nodeName)
                .toList();
        if (ungraded.isEmpty()) {
            return completeCycle(state);
        }
        return Map.of("next", chooseTeam(state, ungraded), "pendingRoute", "");
    }

    private Map<String, Object> completeCycle(RunState state) {
        metrics.recordCycleCompleted();
        if (state.cycleCount() >= properties.getMaxCycles()) {
            String message = maxCyclesMessage(properties.getMaxCycles());
            log.info(message);
            return Map.of("next", HubAndSpoke.FINISH, "stopped", true,
                    RunState.MESSAGES, List.of(new RunMessage(NAME, message)));
        }
        if (properties.isAutoGenerateTasks()) {
            return route(TaskGeneratorNode.NAME);
        }
        log.info("Cycle {} complete and task generation is off, finishing", state.cycleCount());
        return Map.of("next", HubAndSpoke.FINISH, "stopped", true);
    }

    /** A team on a low-quality streak at the limit, or one whose record needs improvement. */
    Optional<Team> teamNeedingImprovement(RunState state) {
        var improvement = properties.getImprovement();
        var policy = improvement.toPolicy();
        return properties.workerTeams().stream()
                .filter(team -> {
                    if (state.lowQualityCount(team.id()) >= improvement.getLowQualityStreakLimit()) {
                        return true;
                    }
                    var record = state.agentPerformance(team.id());
                    int baseline = state.improvedAt().getOrDefault(team.id(), 0);
                    return record.totalAttempts() > baseline && record.needsImprovement(policy);
                })
                .findFirst();
    }

    private String chooseTeam(RunState state, List<String> ungraded) {
        try {
            var decision = oracle.route(NAME, state.messages(), ungraded);
            String choice = decision == null || decision.next() == null ? "" : decision.next().trim();
            if (ungraded.contains(choice)) {
                return choice;
            }
            log.debug("Supervisor answered '{}', falling back to {}", choice, ungraded.get(0));
        } catch (RuntimeException e) {
            log.warn("Supervisor routing call failed, falling back to {}: {}", ungraded.get(0), e.getMessage());
        }
        return ungraded.get(0);
    }

    private static Map<String, Object> route(String next) {
        return Map.of("next", next);
    }

    static String maxCyclesMessage(int maxCycles) {
        return "Maximum cycle count (" + maxCycles + ") reached. Stopping autonomous execution.";
    }
}
