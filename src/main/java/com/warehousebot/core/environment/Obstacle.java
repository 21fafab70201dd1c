package com.warehousebot.core.environment;

import com.warehousebot.core.model.Point;

/**
 * A box-shaped obstacle on the warehouse floor, not part of the static layout.
 */
public record Obstacle(int id, Point center, double width, double length) {

    public Point min() {
        return new Point(center.x() - width / 2, center.y() - length / 2);
    }

    public Point max() {
        return new Point(center.x() + width / 2, center.y() + length / 2);
    }

    public boolean contains(Point point) {
        Point min = min();
        Point max = max();
        return point.x() >= min.x() && point.x() <= max.x()
                && point.y() >= min.y() && point.y() <= max.y();
    }

    /**
     * Distance from {@code point} to the nearest point of the box; 0 inside it.
     */
    public double distanceTo(Point point) {
        Point min = min();
        Point max = max();
        double dx = Math.max(0, Math.max(min.x() - point.x(), point.x() - max.x()));
        double dy = Math.max(0, Math.max(min.y() - point.y(), point.y() - max.y()));
        return Math.hypot(dx, dy);
    }
}
