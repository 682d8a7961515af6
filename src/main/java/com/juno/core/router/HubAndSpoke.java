package com.juno.core.router;

import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.EdgeAction;
import org.bsc.langgraph4j.action.NodeAction;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.AgentStateFactory;
import org.bsc.langgraph4j.state.Channel;

import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Wiring shared by every supervisor graph: the supervisor delegates to a
 * named member, each member returns to the supervisor, and the supervisor
 * eventually answers {@link #FINISH} to end the graph.
 * <pre>
 *   START -> supervisor -> [route] -> member -> supervisor ...
 *                                  -> FINISH -> END
 * </pre>
 */
public final class HubAndSpoke {

    public static final String FINISH = "FINISH";

    private HubAndSpoke() {}

    /**
     * @param supervisorName node name of the supervisor
     * @param supervisor     decides the next hop and stores it in the state
     * @param members        member nodes keyed by name
     * @param route          reads the decided next hop: a member name or {@link #FINISH}
     */
    public static <S extends AgentState> StateGraph<S> build(Map<String, Channel<?>> schema,
                                                             AgentStateFactory<S> stateFactory,
                                                             String supervisorName,
                                                             NodeAction<S> supervisor,
                                                             Map<String, NodeAction<S>> members,
                                                             EdgeAction<S> route) throws GraphStateException {
        var graph = new StateGraph<>(schema, stateFactory)
                .addNode(supervisorName, node_async(supervisor))
                .addEdge(START, supervisorName);

        var routes = new HashMap<String, String>();
        for (var member : members.entrySet()) {
            graph.addNode(member.getKey(), node_async(member.getValue()))
                    .addEdge(member.getKey(), supervisorName);
            routes.put(member.getKey(), member.getKey());
        }
        routes.put(FINISH, END);

        return graph.addConditionalEdges(supervisorName, edge_async(route), routes);
    }
}
