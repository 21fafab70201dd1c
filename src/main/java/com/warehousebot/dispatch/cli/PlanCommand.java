package com.warehousebot.dispatch.cli;

import com.warehousebot.core.engine.SimulationEngine;
import com.warehousebot.core.engine.SimulationProperties;
import com.warehousebot.core.environment.Warehouse;
import com.warehousebot.core.model.ObstacleDetection;
import com.warehousebot.core.model.Point;
import com.warehousebot.core.planning.PathPlanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: warehousebot plan --goal X Y [--start X Y] [--seed N] [--obstacles] [--map]
 * <p>
 * Plans a single path across a generated warehouse and prints the waypoints. With
 * {@code --obstacles} every loose obstacle is treated as a certain detection.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Plan a single path in a generated warehouse")
@Component
public class PlanCommand implements Callable<Integer> {

    @Option(names = {"--goal", "-g"}, arity = "2", required = true, paramLabel = "COORD",
            description = "Goal position in meters: X Y")
    private double[] goal;

    @Option(names = {"--start"}, arity = "2", paramLabel = "COORD",
            description = "Start position in meters: X Y (default: the warehouse start position)")
    private double[] start;

    @Option(names = {"--seed", "-s"}, description = "Layout seed (default: warehousebot.simulation.seed)")
    private Long seed;

    @Option(names = {"--obstacles"}, description = "Avoid the warehouse's loose obstacles")
    private boolean obstacles;

    @Option(names = {"--map"}, description = "Draw the layout and path")
    private boolean map;

    @Option(names = {"--scale"}, defaultValue = "1.0",
            description = "Meters per character when drawing (default: ${DEFAULT-VALUE})")
    private double scale;

    private final SimulationEngine engine;
    private final SimulationProperties properties;

    public PlanCommand(SimulationEngine engine, SimulationProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Warehouse warehouse = engine.generateWarehouse(seed != null ? seed : properties.getSeed());
        Point from = start != null ? new Point(start[0], start[1]) : warehouse.startPosition();
        Point to = new Point(goal[0], goal[1]);

        List<ObstacleDetection> detections = obstacles
                ? warehouse.obstacles().stream().map(o -> ObstacleDetection.box(o.min(), o.max())).toList()
                : List.of();

        PathPlanner planner = engine.plannerFor(warehouse);
        long t0 = System.nanoTime();
        List<Point> path = planner.plan(from, to, detections);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

        if (path.isEmpty()) {
            ConsoleOutput.error(String.format("No path from (%.2f, %.2f) to (%.2f, %.2f)",
                    from.x(), from.y(), to.x(), to.y()));
            return 1;
        }

        ConsoleOutput.success(String.format("%d waypoints, %.2f m, planned in %s",
                path.size(), PathPlanner.pathLength(path), ConsoleOutput.formatDuration(elapsedMs)));
        for (int i = 0; i < path.size(); i++) {
            System.out.printf("  %3d  (%.2f, %.2f)%n", i, path.get(i).x(), path.get(i).y());
        }

        if (map) {
            System.out.println();
            System.out.print(MapRenderer.render(warehouse, path, from, to, scale));
        }
        return 0;
    }
}
