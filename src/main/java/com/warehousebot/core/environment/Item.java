package com.warehousebot.core.environment;

import com.warehousebot.core.model.Point;

/**
 * A stocked item sitting beside a rack.
 */
public record Item(String id, Point position, double weightKg) {
}
