package com.juno.core.router;

import java.util.List;

/**
 * Chooses the next member of a team, or {@link HubAndSpoke#FINISH}.
 */
@FunctionalInterface
public interface RoutingPolicy {
    String next(String team, TeamState state, List<String> members);
}
