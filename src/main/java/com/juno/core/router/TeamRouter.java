package com.juno.core.router;

import com.juno.core.model.RunMessage;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A team as a nested graph: a local supervisor and its members. The
 * supervisor asks the {@link RoutingPolicy} for the next member after every
 * step and stops after {@code maxSteps} member steps.
 */
public class TeamRouter {

    private static final Logger log = LoggerFactory.getLogger(TeamRouter.class);

    public static final String SUPERVISOR = "supervisor";

    private final String teamName;
    private final List<String> members;
    private final Map<String, TeamWorker> workers;
    private final RoutingPolicy policy;
    private final int maxSteps;
    private final CompiledGraph<TeamState> graph;

    /**
     * @param workers members keyed by name, in their natural working order
     */
    public TeamRouter(String teamName, Map<String, TeamWorker> workers, RoutingPolicy policy, int maxSteps)
            throws GraphStateException {
        if (workers.size() < 2) {
            throw new IllegalArgumentException("Team " + teamName + " needs at least two members");
        }
        this.teamName = teamName;
        this.workers = new LinkedHashMap<>(workers);
        this.members = List.copyOf(this.workers.keySet());
        this.policy = policy;
        this.maxSteps = maxSteps;

        var nodes = new LinkedHashMap<String, NodeAction<TeamState>>();
        for (String member : members) {
            nodes.put(member, state -> work(member, state));
        }
        this.graph = HubAndSpoke.build(TeamState.SCHEMA, TeamState::new, SUPERVISOR, this::supervise, nodes,
                        TeamState::next)
                .compile();
        // every member step returns to the supervisor, plus the first and the FINISH step
        graph.setMaxIterations(2 * maxSteps + 2);
    }

    public String teamName() {
        return teamName;
    }

    public List<String> members() {
        return members;
    }

    public TeamRun run(String task, Map<String, Object> context) {
        log.info("Team {} starting", teamName);
        Map<String, Object> input = Map.of(
                "task", task,
                "context", Map.copyOf(context),
                "messages", List.of(new RunMessage("user", task)));
        var result = graph.invoke(input)
                .orElseThrow(() -> new IllegalStateException("Team " + teamName + " returned no state"));
        String output = result.messages().stream()
                .filter(m -> members.contains(m.author()))
                .reduce((first, second) -> second)
                .map(RunMessage::content)
                .orElse("");
        log.info("Team {} finished after {} step(s): {}", teamName, result.steps(), result.visited());
        return new TeamRun(output, result.messages(), result.context(), result.visited(), result.tokens());
    }

    Map<String, Object> supervise(TeamState state) {
        if (state.steps() >= maxSteps) {
            log.debug("Team {} reached its step limit", teamName);
            return Map.of("next", HubAndSpoke.FINISH);
        }
        String next = policy.next(teamName, state, members);
        if (!members.contains(next)) {
            next = HubAndSpoke.FINISH;
        }
        return Map.of("next", next);
    }

    Map<String, Object> work(String member, TeamState state) {
        log.debug("Team {} member {} working", teamName, member);
        var result = workers.get(member).perform(state);
        var context = new HashMap<>(state.context());
        context.putAll(result.contextUpdates());
        var visited = new ArrayList<>(state.visited());
        visited.add(member);
        return Map.of(
                "messages", List.of(new RunMessage(member, result.content())),
                "context", Map.copyOf(context),
                "visited", List.copyOf(visited),
                "steps", state.steps() + 1,
                "tokens", state.tokens() + result.tokensUsed());
    }
}
