package com.juno.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a run, consumed by the CLI watch output.
 *
 * @param type      what happened
 * @param runId     the run this event belongs to
 * @param team      the team this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record JunoEvent(
    JunoEventType type,
    String runId,
    String team,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public JunoEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public static JunoEvent of(JunoEventType type, String runId, String team, Map<String, Object> payload) {
        return new JunoEvent(type, runId, team, payload, Instant.now());
    }

    /** Wire name of the type, e.g. {@code team.graded}. */
    public String eventType() {
        return type.id();
    }
}
