package com.warehousebot.core.environment;

import com.warehousebot.core.model.Point;

/**
 * A storage rack: an axis-aligned block that is part of the static layout.
 */
public record Rack(String id, Point min, Point max) {

    public Point center() {
        return new Point((min.x() + max.x()) / 2, (min.y() + max.y()) / 2);
    }
}
