package com.juno.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory dispatch of run events. A listener registers for one run or for
 * every run, optionally narrowed to a set of event types. A failing
 * listener is logged and skipped; it never fails the publishing node.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    /** runId {@code null} matches every run. */
    private record Listener(String runId, Set<JunoEventType> types, Consumer<JunoEvent> consumer) {

        boolean accepts(JunoEvent event) {
            return (runId == null || runId.equals(event.runId())) && types.contains(event.type());
        }
    }

    public void publish(JunoEvent event) {
        log.debug("Event {} for run {} team {}", event.eventType(), event.runId(), event.team());
        for (Listener listener : listeners) {
            if (listener.accepts(event)) {
                deliver(listener, event);
            }
        }
    }

    public Subscription subscribe(String runId, Consumer<JunoEvent> consumer) {
        return register(new Listener(runId, EnumSet.allOf(JunoEventType.class), consumer));
    }

    /**
     * @param types only events of these types are delivered
     */
    public Subscription subscribe(String runId, Set<JunoEventType> types, Consumer<JunoEvent> consumer) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        return register(new Listener(runId, EnumSet.copyOf(types), consumer));
    }

    public Subscription subscribeAll(Consumer<JunoEvent> consumer) {
        return register(new Listener(null, EnumSet.allOf(JunoEventType.class), consumer));
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Listener listener) {
        listeners.add(listener);
        log.debug("Listener registered for {} ({} type(s))",
                listener.runId() == null ? "all runs" : listener.runId(), listener.types().size());
        return () -> listeners.remove(listener);
    }

    private void deliver(Listener listener, JunoEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }
}
