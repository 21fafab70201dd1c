package com.warehousebot.core.planning;

import com.warehousebot.core.model.Cell;
import com.warehousebot.core.model.ObstacleDetection;
import com.warehousebot.core.model.Point;

import java.util.Arrays;
import java.util.Collection;

/**
 * Immutable occupancy grid of the warehouse floor.
 * <p>
 * Cell {@code (cx, cy)} covers world coordinates
 * {@code [cx * resolution, (cx + 1) * resolution) x [cy * resolution, (cy + 1) * resolution)}.
 * Overlaying obstacles never mutates a map; {@link #withObstacles(Collection)} returns a copy.
 */
public final class GridMap {

    private final int width;
    private final int height;
    private final double resolution;
    private final boolean[] occupied;

    private GridMap(int width, int height, double resolution, boolean[] occupied) {
        this.width = width;
        this.height = height;
        this.resolution = resolution;
        this.occupied = occupied;
    }

    /**
     * Builds a map from a {@code [cy][cx]} occupancy matrix. The matrix is copied.
     */
    public static GridMap of(boolean[][] cells, double resolution) {
        if (cells.length == 0 || cells[0].length == 0) {
            throw new IllegalArgumentException("Grid must have at least one cell");
        }
        var builder = builder(cells[0].length, cells.length, resolution);
        for (int cy = 0; cy < cells.length; cy++) {
            if (cells[cy].length != builder.width) {
                throw new IllegalArgumentException("Ragged grid: row " + cy + " has " + cells[cy].length
                        + " cells, expected " + builder.width);
            }
            for (int cx = 0; cx < builder.width; cx++) {
                if (cells[cy][cx]) builder.occupy(cx, cy);
            }
        }
        return builder.build();
    }

    /**
     * Parses rows of {@code '#'} (occupied) and {@code '.'} (free). Row {@code i} is {@code cy = i}.
     */
    public static GridMap parse(double resolution, String... rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Grid must have at least one row");
        }
        var cells = new boolean[rows.length][];
        for (int cy = 0; cy < rows.length; cy++) {
            String row = rows[cy];
            cells[cy] = new boolean[row.length()];
            for (int cx = 0; cx < row.length(); cx++) {
                cells[cy][cx] = row.charAt(cx) == '#';
            }
        }
        return of(cells, resolution);
    }

    public static GridMap empty(int width, int height, double resolution) {
        return builder(width, height, resolution).build();
    }

    public static Builder builder(int width, int height, double resolution) {
        return new Builder(width, height, resolution, null);
    }

    public int width() { return width; }
    public int height() { return height; }
    public double resolution() { return resolution; }

    public boolean inBounds(int cx, int cy) {
        return cx >= 0 && cx < width && cy >= 0 && cy < height;
    }

    /**
     * Out-of-bounds cells count as occupied.
     */
    public boolean isOccupied(int cx, int cy) {
        return !inBounds(cx, cy) || occupied[cy * width + cx];
    }

    public boolean isOccupied(Cell cell) {
        return isOccupied(cell.cx(), cell.cy());
    }

    public boolean isOccupied(Point point) {
        return isOccupied(toCell(point));
    }

    /**
     * World to grid: {@code floor(world / resolution)}, clamped to the grid bounds.
     */
    public Cell toCell(Point point) {
        int cx = (int) Math.floor(point.x() / resolution);
        int cy = (int) Math.floor(point.y() / resolution);
        return new Cell(clamp(cx, width), clamp(cy, height));
    }

    /**
     * Grid to world: the center of the cell.
     */
    public Point toWorld(Cell cell) {
        return new Point((cell.cx() + 0.5) * resolution, (cell.cy() + 0.5) * resolution);
    }

    public int freeCellCount() {
        int free = 0;
        for (boolean cell : occupied) {
            if (!cell) free++;
        }
        return free;
    }

    public int cellCount() {
        return occupied.length;
    }

    /**
     * Returns a copy of this map with every detection's bounding box marked occupied.
     * Boxes reaching outside the grid are clamped to it.
     */
    public GridMap withObstacles(Collection<ObstacleDetection> detections) {
        var builder = new Builder(width, height, resolution, occupied);
        for (ObstacleDetection detection : detections) {
            builder.occupyBox(detection.min(), detection.max());
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "GridMap(" + width + "x" + height + ", resolution=" + resolution + "m)";
    }

    private static int clamp(int value, int size) {
        return Math.max(0, Math.min(size - 1, value));
    }

    /**
     * Mutable staging area for a {@link GridMap}; {@link #build()} snapshots the cells.
     */
    public static final class Builder {

        private final int width;
        private final int height;
        private final double resolution;
        private final boolean[] cells;

        private Builder(int width, int height, double resolution, boolean[] source) {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
            }
            if (!(resolution > 0)) {
                throw new IllegalArgumentException("Resolution must be positive: " + resolution);
            }
            this.width = width;
            this.height = height;
            this.resolution = resolution;
            this.cells = source != null ? Arrays.copyOf(source, source.length) : new boolean[width * height];
        }

        public Builder occupy(int cx, int cy) {
            if (cx >= 0 && cx < width && cy >= 0 && cy < height) {
                cells[cy * width + cx] = true;
            }
            return this;
        }

        /**
         * Marks every cell touched by the world-coordinate box, inclusive of both corners.
         */
        public Builder occupyBox(Point min, Point max) {
            int x0 = clamp((int) Math.floor(Math.min(min.x(), max.x()) / resolution), width);
            int x1 = clamp((int) Math.floor(Math.max(min.x(), max.x()) / resolution), width);
            int y0 = clamp((int) Math.floor(Math.min(min.y(), max.y()) / resolution), height);
            int y1 = clamp((int) Math.floor(Math.max(min.y(), max.y()) / resolution), height);
            for (int cy = y0; cy <= y1; cy++) {
                for (int cx = x0; cx <= x1; cx++) {
                    cells[cy * width + cx] = true;
                }
            }
            return this;
        }

        public GridMap build() {
            return new GridMap(width, height, resolution, Arrays.copyOf(cells, cells.length));
        }
    }
}
