package com.warehousebot.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a simulation run, consumed by telemetry subscribers.
 *
 * @param eventType event type (e.g. "run.started", "task.dispatched", "path.fallback")
 * @param runId     the simulation run this event belongs to
 * @param taskId    the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record WarehouseEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
