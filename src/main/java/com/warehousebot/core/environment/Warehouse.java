package com.warehousebot.core.environment;

import com.warehousebot.core.model.Point;
import com.warehousebot.core.model.Task;
import com.warehousebot.core.model.TaskType;
import com.warehousebot.core.planning.GridMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * A generated warehouse: static layout grid, racks, loose obstacles, items and chargers.
 * <p>
 * Loose obstacles are not in {@link #map()}; the robot only learns about them through perception.
 */
public class Warehouse {

    private static final double PICK_WEIGHT = 0.45;
    private static final double PLACE_WEIGHT = 0.45;

    private final GridMap map;
    private final double width;
    private final double length;
    private final List<Rack> racks;
    private final List<Obstacle> obstacles;
    private final List<Item> items;
    private final List<Point> chargingStations;
    private final Point startPosition;
    private int taskCounter;

    public Warehouse(GridMap map, double width, double length, List<Rack> racks, List<Obstacle> obstacles,
                     List<Item> items, List<Point> chargingStations, Point startPosition) {
        this.map = map;
        this.width = width;
        this.length = length;
        this.racks = List.copyOf(racks);
        this.obstacles = List.copyOf(obstacles);
        this.items = List.copyOf(items);
        this.chargingStations = List.copyOf(chargingStations);
        this.startPosition = startPosition;
    }

    public GridMap map() { return map; }
    public double width() { return width; }
    public double length() { return length; }
    public List<Rack> racks() { return racks; }
    public List<Obstacle> obstacles() { return obstacles; }
    public List<Item> items() { return items; }
    public List<Point> chargingStations() { return chargingStations; }
    public Point startPosition() { return startPosition; }

    /**
     * Draws a PICK (45%), PLACE (45%) or CHARGE (10%) task. Empty when the drawn type has
     * nothing to target (no items, racks or chargers).
     */
    public Optional<Task> generateTask(Random random) {
        double roll = random.nextDouble();
        if (roll < PICK_WEIGHT) {
            if (items.isEmpty()) return Optional.empty();
            Item item = items.get(random.nextInt(items.size()));
            return Optional.of(new Task(nextTaskId(), TaskType.PICK, item.position(), item.id(), null,
                    item.weightKg()));
        }
        if (roll < PICK_WEIGHT + PLACE_WEIGHT) {
            if (racks.isEmpty()) return Optional.empty();
            Rack rack = racks.get(random.nextInt(racks.size()));
            Point position = WarehouseGenerator.besideRack(rack, random);
            return Optional.of(new Task(nextTaskId(), TaskType.PLACE, position, null, rack.id()));
        }
        if (chargingStations.isEmpty()) return Optional.empty();
        int station = random.nextInt(chargingStations.size());
        return Optional.of(new Task(nextTaskId(), TaskType.CHARGE, chargingStations.get(station),
                null, "CHARGER-" + station));
    }

    public List<Task> generateTasks(int count, Random random) {
        var tasks = new ArrayList<Task>(count);
        for (int i = 0; i < count; i++) {
            generateTask(random).ifPresent(tasks::add);
        }
        return tasks;
    }

    /**
     * Obstacles whose nearest surface point lies within {@code range} of {@code position}.
     */
    public List<Obstacle> obstaclesWithin(Point position, double range) {
        return obstacles.stream()
                .filter(o -> o.distanceTo(position) <= range)
                .toList();
    }

    private String nextTaskId() {
        return String.format("TASK-%04d", ++taskCounter);
    }

    @Override
    public String toString() {
        return String.format("Warehouse(%.1fx%.1fm, %d racks, %d obstacles, %d items)",
                width, length, racks.size(), obstacles.size(), items.size());
    }
}
