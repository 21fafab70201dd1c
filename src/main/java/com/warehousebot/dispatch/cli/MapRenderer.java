package com.warehousebot.dispatch.cli;

import com.warehousebot.core.environment.Obstacle;
import com.warehousebot.core.environment.Warehouse;
import com.warehousebot.core.model.Cell;
import com.warehousebot.core.model.Point;
import com.warehousebot.core.planning.GridMap;
import com.warehousebot.core.planning.LineOfSight;

import java.util.Collection;
import java.util.List;

/**
 * Draws a warehouse and a planned path as ASCII art, one character per {@code scale}
 * meters, north up.
 * <pre>
 *   #  rack      o  loose obstacle
 *   *  path      S/G  start and goal
 * </pre>
 */
final class MapRenderer {

    private MapRenderer() {}

    static String render(Warehouse warehouse, List<Point> path, Point start, Point goal, double scale) {
        GridMap map = warehouse.map();
        int block = Math.max(1, (int) Math.round(scale / map.resolution()));
        int cols = (map.width() + block - 1) / block;
        int rows = (map.height() + block - 1) / block;
        char[][] canvas = new char[rows][cols];

        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                canvas[r][c] = anyOccupied(map, c * block, r * block, block) ? '#' : '.';
            }
        }
        drawObstacles(canvas, map, warehouse.obstacles(), block);

        for (int i = 1; i < path.size(); i++) {
            for (Cell cell : LineOfSight.rasterize(map.toCell(path.get(i - 1)), map.toCell(path.get(i)))) {
                canvas[cell.cy() / block][cell.cx() / block] = '*';
            }
        }
        mark(canvas, map, start, block, 'S');
        mark(canvas, map, goal, block, 'G');

        var out = new StringBuilder();
        for (int r = rows - 1; r >= 0; r--) {
            out.append(canvas[r]).append(System.lineSeparator());
        }
        return out.toString();
    }

    private static boolean anyOccupied(GridMap map, int cx0, int cy0, int block) {
        for (int cy = cy0; cy < Math.min(cy0 + block, map.height()); cy++) {
            for (int cx = cx0; cx < Math.min(cx0 + block, map.width()); cx++) {
                if (map.isOccupied(cx, cy)) return true;
            }
        }
        return false;
    }

    private static void drawObstacles(char[][] canvas, GridMap map, Collection<Obstacle> obstacles, int block) {
        for (Obstacle obstacle : obstacles) {
            Cell lo = map.toCell(obstacle.min());
            Cell hi = map.toCell(obstacle.max());
            for (int cy = lo.cy() / block; cy <= hi.cy() / block; cy++) {
                for (int cx = lo.cx() / block; cx <= hi.cx() / block; cx++) {
                    if (canvas[cy][cx] == '.') canvas[cy][cx] = 'o';
                }
            }
        }
    }

    private static void mark(char[][] canvas, GridMap map, Point point, int block, char symbol) {
        Cell cell = map.toCell(point);
        canvas[cell.cy() / block][cell.cx() / block] = symbol;
    }
}
