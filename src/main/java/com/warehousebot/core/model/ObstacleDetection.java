package com.warehousebot.core.model;

import java.io.Serializable;

/**
 * An obstacle reported by perception, as an axis-aligned bounding box in world coordinates.
 *
 * @param min        lower-left corner
 * @param max        upper-right corner
 * @param confidence detector confidence in [0, 1]
 */
public record ObstacleDetection(
    Point min,
    Point max,
    double confidence
) implements Serializable {

    public static ObstacleDetection box(Point min, Point max) {
        return new ObstacleDetection(min, max, 1.0);
    }
}
