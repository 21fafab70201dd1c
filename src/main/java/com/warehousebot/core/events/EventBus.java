package com.warehousebot.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for simulation telemetry.
 * <p>
 * A listener is scoped to one run or to every run, and may restrict itself to a set of event
 * types. Listeners are delivered to in subscription order. Thread-safe for concurrent publish and
 * subscribe operations; a listener that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(WarehouseEvent event) {
        log.debug("Publishing {} for run {}", event.eventType(), event.runId());
        for (Listener listener : listeners) {
            if (listener.accepts(event)) {
                listener.deliver(event);
            }
        }
    }

    /**
     * Subscribe to every event of one run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<WarehouseEvent> consumer) {
        return subscribe(runId, Set.of(), consumer);
    }

    /**
     * Subscribe to events of one run whose type is in {@code eventTypes}; an empty set means all.
     */
    public Subscription subscribe(String runId, Set<String> eventTypes, Consumer<WarehouseEvent> consumer) {
        if (runId == null) {
            throw new IllegalArgumentException("runId must not be null; use subscribeAll");
        }
        return add(new Listener(runId, Set.copyOf(eventTypes), consumer));
    }

    public Subscription subscribeAll(Consumer<WarehouseEvent> consumer) {
        return add(new Listener(null, Set.of(), consumer));
    }

    /**
     * Number of live subscriptions scoped to {@code runId}.
     */
    public int subscriberCount(String runId) {
        return (int) listeners.stream().filter(l -> runId.equals(l.runId())).count();
    }

    private Subscription add(Listener listener) {
        listeners.add(listener);
        log.debug("Subscribed to {} (types {})",
                listener.runId() == null ? "all runs" : listener.runId(),
                listener.eventTypes().isEmpty() ? "all" : listener.eventTypes());
        return () -> listeners.removeIf(l -> l == listener);
    }

    /**
     * Handle for cancelling a subscription. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Listener(String runId, Set<String> eventTypes, Consumer<WarehouseEvent> consumer) {

        boolean accepts(WarehouseEvent event) {
            return (runId == null || runId.equals(event.runId()))
                    && (eventTypes.isEmpty() || eventTypes.contains(event.eventType()));
        }

        void deliver(WarehouseEvent event) {
            try {
                consumer.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber threw exception processing event {}: {}",
                        event.eventType(), e.getMessage(), e);
            }
        }
    }
}
