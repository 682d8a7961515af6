package com.juno.core.router;

import com.juno.core.oracle.Oracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Lets the oracle pick the next member. An answer that names no member,
 * a FINISH before any member has worked, or a failed call falls back to
 * the first member not yet visited, then to FINISH.
 */
public class OracleRoutingPolicy implements RoutingPolicy {

    private static final Logger log = LoggerFactory.getLogger(OracleRoutingPolicy.class);

    private final Oracle oracle;

    public OracleRoutingPolicy(Oracle oracle) {
        this.oracle = oracle;
    }

    @Override
    public String next(String team, TeamState state, List<String> members) {
        try {
            var decision = oracle.route(team + " supervisor", state.messages(), members);
            String choice = decision == null || decision.next() == null ? "" : decision.next().trim();
            if (members.contains(choice)) {
                return choice;
            }
            if (HubAndSpoke.FINISH.equalsIgnoreCase(choice) && !state.visited().isEmpty()) {
                return HubAndSpoke.FINISH;
            }
            log.debug("Router for {} answered '{}', using fallback", team, choice);
        } catch (RuntimeException e) {
            log.warn("Routing call for {} failed, using fallback: {}", team, e.getMessage());
        }
        return fallback(state, members);
    }

    static String fallback(TeamState state, List<String> members) {
        return members.stream()
                .filter(m -> !state.visited().contains(m))
                .findFirst()
                .orElse(HubAndSpoke.FINISH);
    }
}
