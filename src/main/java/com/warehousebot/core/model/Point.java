package com.warehousebot.core.model;

import java.io.Serializable;

/**
 * A position on the warehouse floor in world coordinates.
 *
 * @param x meters along the warehouse width
 * @param y meters along the warehouse length
 */
public record Point(double x, double y) implements Serializable {

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    public Point plus(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }
}
