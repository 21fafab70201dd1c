package com.warehousebot.core.environment;

import com.warehousebot.core.model.Point;
import com.warehousebot.core.planning.GridMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds a synthetic {@link Warehouse} from {@link WarehouseProperties}.
 * <p>
 * Racks are laid out in two rows (at one and two thirds of the warehouse length), centered
 * across the width and separated by aisles. All randomness comes from the caller's
 * {@link Random}, so a fixed seed reproduces the same warehouse.
 */
public class WarehouseGenerator {

    private static final Logger log = LoggerFactory.getLogger(WarehouseGenerator.class);

    private static final int PLACEMENT_ATTEMPTS = 10;
    private static final double AISLE_OFFSET = 0.5;
    private static final double WALL_OFFSET = 1.0;
    private static final double START_CLEARANCE = 1.0;

    private final WarehouseProperties properties;
    private final double resolution;

    public WarehouseGenerator(WarehouseProperties properties, double resolution) {
        this.properties = properties;
        this.resolution = resolution;
    }

    public Warehouse generate(Random random) {
        double width = properties.getWidth();
        double length = properties.getLength();
        int gridWidth = (int) Math.ceil(width / resolution);
        int gridHeight = (int) Math.ceil(length / resolution);

        List<Rack> racks = layoutRacks(width, length);
        var builder = GridMap.builder(gridWidth, gridHeight, resolution);
        for (Rack rack : racks) {
            builder.occupyBox(rack.min(), rack.max());
        }
        GridMap map = builder.build();

        Point start = startPosition();
        List<Obstacle> obstacles = placeObstacles(map, racks, start, random);
        List<Item> items = placeItems(racks, random);
        List<Point> chargers = placeChargers(width, length, random);

        var warehouse = new Warehouse(map, width, length, racks, obstacles, items, chargers, start);
        log.info("Generated {} on {}", warehouse, map);
        return warehouse;
    }

    /**
     * A free aisle position next to {@code rack}, on a random side and at a random depth.
     */
    static Point besideRack(Rack rack, Random random) {
        boolean west = random.nextBoolean();
        double x = west ? rack.min().x() - AISLE_OFFSET : rack.max().x() + AISLE_OFFSET;
        double y = rack.min().y() + random.nextDouble() * (rack.max().y() - rack.min().y());
        return new Point(x, y);
    }

    List<Rack> layoutRacks(double width, double length) {
        var rackProps = properties.getRacks();
        int perRow = rackProps.getCount() / 2;
        double pitch = rackProps.getWidth() + rackProps.getAisleWidth();
        double firstX = width / 2 - perRow * pitch / 2;
        double[] rowStarts = {length / 3, 2 * length / 3};

        var racks = new ArrayList<Rack>();
        for (int row = 0; row < rowStarts.length; row++) {
            for (int i = 0; i < perRow; i++) {
                double x = firstX + i * pitch;
                double y = rowStarts[row];
                racks.add(new Rack(String.format("RACK-%02d", racks.size() + 1),
                        new Point(x, y),
                        new Point(x + rackProps.getWidth(), y + rackProps.getLength())));
            }
        }
        return racks;
    }

    private List<Obstacle> placeObstacles(GridMap map, List<Rack> racks, Point start, Random random) {
        double rackArea = 0.0;
        for (Rack rack : racks) {
            rackArea += (rack.max().x() - rack.min().x()) * (rack.max().y() - rack.min().y());
        }
        double freeArea = properties.getWidth() * properties.getLength() - rackArea;
        int target = (int) (freeArea * properties.getObstacleDensity());

        var obstacles = new ArrayList<Obstacle>();
        for (int i = 0; i < target; i++) {
            for (int attempt = 0; attempt < PLACEMENT_ATTEMPTS; attempt++) {
                var center = new Point(random.nextDouble() * properties.getWidth(),
                        random.nextDouble() * properties.getLength());
                if (map.isOccupied(center) || center.distanceTo(start) < START_CLEARANCE
                        || obstacles.stream().anyMatch(o -> o.contains(center))) {
                    continue;
                }
                obstacles.add(new Obstacle(obstacles.size(), center,
                        0.3 + random.nextDouble() * 0.7,
                        0.3 + random.nextDouble() * 0.7));
                break;
            }
        }
        log.debug("Placed {}/{} obstacles", obstacles.size(), target);
        return obstacles;
    }

    private List<Item> placeItems(List<Rack> racks, Random random) {
        if (racks.isEmpty()) {
            return List.of();
        }
        var items = new ArrayList<Item>();
        for (int i = 0; i < properties.getNumItems(); i++) {
            Rack rack = racks.get(random.nextInt(racks.size()));
            double weight = 0.1 + random.nextDouble() * 3.9;
            items.add(new Item(String.format("ITEM-%03d", i), besideRack(rack, random), weight));
        }
        return items;
    }

    private List<Point> placeChargers(double width, double length, Random random) {
        var chargers = new ArrayList<Point>();
        for (int i = 0; i < properties.getChargingStations(); i++) {
            double alongWidth = WALL_OFFSET + random.nextDouble() * (width - 2 * WALL_OFFSET);
            double alongLength = WALL_OFFSET + random.nextDouble() * (length - 2 * WALL_OFFSET);
            chargers.add(switch (i % 4) {
                case 0 -> new Point(alongWidth, WALL_OFFSET);
                case 1 -> new Point(width - WALL_OFFSET, alongLength);
                case 2 -> new Point(alongWidth, length - WALL_OFFSET);
                default -> new Point(WALL_OFFSET, alongLength);
            });
        }
        return chargers;
    }

    private Point startPosition() {
        List<Double> start = properties.getStartPosition();
        if (start == null || start.size() != 2) {
            throw new IllegalArgumentException("warehousebot.warehouse.start-position must have two coordinates, got " + start);
        }
        return new Point(start.get(0), start.get(1));
    }
}
