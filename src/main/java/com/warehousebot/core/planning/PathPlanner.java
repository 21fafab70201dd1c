package com.warehousebot.core.planning;

import com.warehousebot.core.model.Cell;
import com.warehousebot.core.model.ObstacleDetection;
import com.warehousebot.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;

/**
 * A* path planner over an 8-connected occupancy grid.
 * <p>
 * Each query works on its own copy of the stored map with the caller's fresh detections
 * rasterized onto it. Straight steps cost 1, diagonal steps cost sqrt(2), and the Euclidean
 * heuristic keeps the search admissible and consistent, so every cell is expanded at most once.
 * Frontier ties on {@code f} are broken by insertion order.
 * <p>
 * "No path" is an empty list, whether the start or goal cell is occupied, the frontier runs dry,
 * or the expansion bound is hit. {@link #directLine(Point, Point)} is the documented fallback;
 * it may cross obstacles.
 * <p>
 * Not thread-safe.
 */
public class PathPlanner {

    private static final Logger log = LoggerFactory.getLogger(PathPlanner.class);

    private static final double DIAGONAL_COST = Math.sqrt(2.0);

    private static final int[][] NEIGHBOURS = {
            {0, 1}, {1, 0}, {0, -1}, {-1, 0},
            {1, 1}, {1, -1}, {-1, 1}, {-1, -1}
    };

    private final GridMap map;
    private final int maxExpansions;
    private final boolean simplify;

    public PathPlanner(GridMap map) {
        this(map, 0, true);
    }

    public PathPlanner(GridMap map, PlannerProperties properties) {
        this(map, properties.getMaxExpansions(), properties.isSimplify());
    }

    public PathPlanner(GridMap map, int maxExpansions, boolean simplify) {
        if (map == null) {
            throw new IllegalArgumentException("map must not be null");
        }
        this.map = map;
        this.maxExpansions = maxExpansions;
        this.simplify = simplify;
    }

    public GridMap map() {
        return map;
    }

    public List<Point> plan(Point start, Point goal) {
        return plan(start, goal, List.of());
    }

    /**
     * Plans a waypoint path from {@code start} to {@code goal}.
     *
     * @param start      start position in world coordinates
     * @param goal       goal position in world coordinates
     * @param detections freshly perceived obstacles to avoid for this query only (nullable)
     * @return cell-center waypoints from the start cell to the goal cell, or an empty list if no path exists
     */
    public List<Point> plan(Point start, Point goal, Collection<ObstacleDetection> detections) {
        GridMap working = workingGrid(detections);
        Cell startCell = working.toCell(start);
        Cell goalCell = working.toCell(goal);

        List<Cell> cells = search(working, startCell, goalCell);
        if (cells.isEmpty()) {
            log.debug("No path from {} to {} ({} detections)", startCell, goalCell,
                    detections == null ? 0 : detections.size());
            return List.of();
        }

        var waypoints = new ArrayList<Point>(cells.size());
        for (Cell cell : cells) {
            waypoints.add(working.toWorld(cell));
        }
        List<Point> result = simplify ? simplify(waypoints, working) : waypoints;
        log.debug("Planned {} -> {}: {} grid cells, {} waypoints", startCell, goalCell, cells.size(), result.size());
        return Collections.unmodifiableList(result);
    }

    /**
     * Raw 8-connected grid path between two cells, or an empty list if none exists.
     */
    public List<Cell> findCellPath(Cell start, Cell goal, Collection<ObstacleDetection> detections) {
        return search(workingGrid(detections), start, goal);
    }

    /**
     * The grid a query with these detections searches: the stored map itself when there are none,
     * otherwise an overlaid copy.
     */
    public GridMap workingGrid(Collection<ObstacleDetection> detections) {
        if (detections == null || detections.isEmpty()) {
            return map;
        }
        return map.withObstacles(detections);
    }

    /**
     * Two-point fallback path. Does not avoid obstacles.
     */
    public static List<Point> directLine(Point start, Point goal) {
        return List.of(start, goal);
    }

    /**
     * Sum of step costs along a grid path (1 per straight step, sqrt(2) per diagonal step).
     */
    public static double pathCost(List<Cell> cells) {
        double cost = 0.0;
        for (int i = 1; i < cells.size(); i++) {
            Cell a = cells.get(i - 1);
            Cell b = cells.get(i);
            boolean diagonal = a.cx() != b.cx() && a.cy() != b.cy();
            cost += diagonal ? DIAGONAL_COST : 1.0;
        }
        return cost;
    }

    /**
     * Euclidean length of a waypoint path in meters.
     */
    public static double pathLength(List<Point> waypoints) {
        double length = 0.0;
        for (int i = 1; i < waypoints.size(); i++) {
            length += waypoints.get(i - 1).distanceTo(waypoints.get(i));
        }
        return length;
    }

    // ============ A* ============

    List<Cell> search(GridMap grid, Cell start, Cell goal) {
        if (grid.isOccupied(start) || grid.isOccupied(goal)) {
            return List.of();
        }

        int width = grid.width();
        int cellCount = width * grid.height();
        int startIndex = start.cy() * width + start.cx();
        int goalIndex = goal.cy() * width + goal.cx();

        double[] g = new double[cellCount];
        Arrays.fill(g, Double.POSITIVE_INFINITY);
        int[] parent = new int[cellCount];
        Arrays.fill(parent, -1);
        boolean[] closed = new boolean[cellCount];

        PriorityQueue<SearchNode> open = new PriorityQueue<>();
        long sequence = 0;
        g[startIndex] = 0.0;
        open.add(new SearchNode(startIndex, heuristic(start.cx(), start.cy(), goal), sequence++));

        int expansions = 0;
        while (!open.isEmpty()) {
            SearchNode current = open.poll();
            if (closed[current.index]) continue;

            if (current.index == goalIndex) {
                return reconstructPath(parent, goalIndex, width);
            }
            closed[current.index] = true;

            if (maxExpansions > 0 && ++expansions > maxExpansions) {
                log.warn("A* gave up after {} expansions from {} to {}", maxExpansions, start, goal);
                return List.of();
            }

            int cx = current.index % width;
            int cy = current.index / width;
            for (int[] step : NEIGHBOURS) {
                int nx = cx + step[0];
                int ny = cy + step[1];
                if (grid.isOccupied(nx, ny)) continue;
                int neighbour = ny * width + nx;
                if (closed[neighbour]) continue;

                double stepCost = step[0] != 0 && step[1] != 0 ? DIAGONAL_COST : 1.0;
                double tentative = g[current.index] + stepCost;
                if (tentative < g[neighbour]) {
                    g[neighbour] = tentative;
                    parent[neighbour] = current.index;
                    open.add(new SearchNode(neighbour, tentative + heuristic(nx, ny, goal), sequence++));
                }
            }
        }
        return List.of();
    }

    private static double heuristic(int cx, int cy, Cell goal) {
        return Math.hypot(goal.cx() - cx, goal.cy() - cy);
    }

    private static List<Cell> reconstructPath(int[] parent, int goalIndex, int width) {
        var path = new ArrayList<Cell>();
        for (int index = goalIndex; index != -1; index = parent[index]) {
            path.add(new Cell(index % width, index / width));
        }
        Collections.reverse(path);
        return path;
    }

    // ============ Simplification ============

    /**
     * Greedy line-of-sight reduction: from the cursor, jump to the furthest waypoint visible on
     * {@code grid}, or to the next one if none is. The cursor only moves forward.
     */
    List<Point> simplify(List<Point> path, GridMap grid) {
        if (path.size() <= 2) {
            return path;
        }
        int last = path.size() - 1;
        var simplified = new ArrayList<Point>();
        simplified.add(path.get(0));

        int cursor = 0;
        while (cursor < last) {
            Cell from = grid.toCell(path.get(cursor));
            int next = cursor + 1;
            for (int i = last; i > cursor; i--) {
                if (LineOfSight.isClear(grid, from, grid.toCell(path.get(i)))) {
                    next = i;
                    break;
                }
            }
            simplified.add(path.get(next));
            cursor = next;
        }
        return simplified;
    }

    private static final class SearchNode implements Comparable<SearchNode> {
        final int index;
        final double f;
        final long sequence;

        SearchNode(int index, double f, long sequence) {
            this.index = index;
            this.f = f;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(SearchNode other) {
            int cmp = Double.compare(this.f, other.f);
            if (cmp != 0) return cmp;
            return Long.compare(this.sequence, other.sequence);
        }
    }
}
