package com.warehousebot.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A unit of warehouse work handed to the scheduler.
 *
 * @param id       stable identifier (e.g., "TASK-0001"), used as the scheduler's membership key
 * @param type     PICK, PLACE or CHARGE
 * @param position target position in world coordinates
 * @param itemId   item to pick up (PICK only, nullable)
 * @param location drop-off label (PLACE only, nullable)
 * @param weightKg weight of the item to pick up; 0 for tasks that lift nothing
 */
public record Task(
    String id,
    TaskType type,
    Point position,
    String itemId,
    String location,
    double weightKg
) implements Serializable {

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(position, "position");
        if (weightKg < 0) {
            throw new IllegalArgumentException("weightKg must not be negative: " + weightKg);
        }
    }

    public Task(String id, TaskType type, Point position, String itemId, String location) {
        this(id, type, position, itemId, location, 0.0);
    }

    public static Task of(String id, TaskType type, Point position) {
        return new Task(id, type, position, null, null);
    }
}
