package com.juno.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A code fix proposed by the improvement team and validated in the sandbox.
 */
public record CodeChange(
        String changeId,
        int cycle,
        String description,
        String code,
        List<String> issuesFixed,
        Instant timestamp
) implements Serializable {

    public CodeChange {
        issuesFixed = issuesFixed == null ? List.of() : List.copyOf(issuesFixed);
    }
}
