package com.warehousebot.core.planning;

import com.warehousebot.core.model.Cell;

import java.util.ArrayList;
import java.util.List;

/**
 * Bresenham line rasterization over a {@link GridMap}.
 */
public final class LineOfSight {

    private LineOfSight() {}

    /**
     * True when no cell on the rasterized segment, endpoints included, is occupied.
     */
    public static boolean isClear(GridMap grid, Cell from, Cell to) {
        for (Cell cell : rasterize(from, to)) {
            if (grid.isOccupied(cell)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Cells visited by the integer Bresenham line from {@code from} to {@code to}, in order.
     */
    public static List<Cell> rasterize(Cell from, Cell to) {
        int x0 = from.cx();
        int y0 = from.cy();
        int x1 = to.cx();
        int y1 = to.cy();
        int dx = Math.abs(x1 - x0);
        int dy = Math.abs(y1 - y0);
        int sx = x0 < x1 ? 1 : -1;
        int sy = y0 < y1 ? 1 : -1;
        int err = dx - dy;

        var cells = new ArrayList<Cell>(Math.max(dx, dy) + 1);
        while (true) {
            cells.add(new Cell(x0, y0));
            if (x0 == x1 && y0 == y1) {
                return cells;
            }
            int e2 = 2 * err;
            if (e2 > -dy) {
                err -= dy;
                x0 += sx;
            }
            if (e2 < dx) {
                err += dx;
                y0 += sy;
            }
        }
    }
}
