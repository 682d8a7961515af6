package com.juno.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A request to change a team's agent count. Consumed exactly once by the allocator.
 */
public record ResourceChangeRequest(
        String team,
        int currentAgents,
        int recommendedAgents,
        String reason,
        Instant timestamp
) implements Serializable {}
