package com.warehousebot.core.model;

import java.io.Serializable;

/**
 * Integer coordinate of a cell in an occupancy grid.
 */
public record Cell(int cx, int cy) implements Serializable {
}
