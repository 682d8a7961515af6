package com.juno.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * History entry written when a {@link ResourceChangeRequest} is applied.
 */
public record AppliedResourceChange(
        String team,
        int oldAgents,
        int newAgents,
        String reason,
        Instant appliedAt
) implements Serializable {}
