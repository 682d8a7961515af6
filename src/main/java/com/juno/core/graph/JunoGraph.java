package com.juno.core.graph;

import com.juno.core.config.JunoProperties;
import com.juno.core.model.Team;
import com.juno.core.nodes.JunoTeamNode;
import com.juno.core.nodes.SupervisorNode;
import com.juno.core.nodes.TaskGeneratorNode;
import com.juno.core.nodes.WorkerTeamNode;
import com.juno.core.router.HubAndSpoke;
import com.juno.core.state.RunState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Builds the top-level graph and compiles it once per run.
 * <pre>
 *   START -> supervisor -> [next]
 *              -> research_team  -> supervisor
 *              -> writing_team   -> supervisor
 *              -> juno_team      -> supervisor
 *              -> task_generator -> supervisor
 *              -> FINISH -> END
 * </pre>
 * Each team node runs its own nested team graph.
 */
@Component
public class JunoGraph {

    private static final Logger log = LoggerFactory.getLogger(JunoGraph.class);

    /** Supervisor step at the start plus the final FINISH step. */
    static final int RUN_OVERHEAD_STEPS = 2;

    private final StateGraph<RunState> stateGraph;
    private final JunoProperties properties;

    public JunoGraph(SupervisorNode supervisorNode,
                     WorkerTeamNode workerTeamNode,
                     JunoTeamNode junoTeamNode,
                     TaskGeneratorNode taskGeneratorNode,
                     JunoProperties properties) throws GraphStateException {

        var nodes = new LinkedHashMap<String, NodeAction<RunState>>();
        nodes.put(Team.RESEARCH.nodeName(), state -> workerTeamNode.apply(state, Team.RESEARCH));
        nodes.put(Team.WRITING.nodeName(), state -> workerTeamNode.apply(state, Team.WRITING));
        nodes.put(Team.JUNO.nodeName(), junoTeamNode::apply);
        nodes.put(TaskGeneratorNode.NAME, taskGeneratorNode::apply);

        this.stateGraph = HubAndSpoke.build(RunState.SCHEMA, RunState::new,
                SupervisorNode.NAME, supervisorNode::apply, nodes, RunState::next);
        this.properties = properties;
        // fail at startup on a miswired graph
        stateGraph.compile();
        log.info("Graph built with nodes {}", nodes.keySet());
    }

    /**
     * Compiles the graph for one run with a step budget that covers
     * {@code max-cycles} complete cycles. Call after the configuration has
     * been validated.
     */
    public CompiledGraph<RunState> compileForRun() {
        try {
            var compiled = stateGraph.compile();
            int budget = stepBudget(properties);
            compiled.setMaxIterations(budget);
            log.debug("Run graph compiled with a budget of {} steps", budget);
            return compiled;
        } catch (GraphStateException e) {
            throw new IllegalStateException("Graph could not be compiled: " + e.getMessage(), e);
        }
    }

    /**
     * Worst case per cycle: task generation and the supervisor step after it,
     * every worker team and its return to the supervisor, and one improvement
     * visit per worker team plus one for a resource request raised at task
     * start. {@code recursion-limit} acts as a floor.
     */
    static int stepBudget(JunoProperties properties) {
        int workers = properties.workerTeams().size();
        int improvementVisits = properties.isJunoEnabled() ? workers + 1 : 0;
        int perCycle = 2 + 2 * workers + 2 * improvementVisits;
        long budget = (long) properties.getMaxCycles() * perCycle + RUN_OVERHEAD_STEPS;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(properties.getRecursionLimit(), budget));
    }
}
