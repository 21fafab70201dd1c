package com.warehousebot.core.health;

import com.warehousebot.core.engine.SimulationEngine;
import com.warehousebot.core.environment.Warehouse;
import com.warehousebot.core.metrics.WarehouseMetrics;
import com.warehousebot.core.model.Cell;
import com.warehousebot.core.planning.GridMap;
import com.warehousebot.core.scheduler.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    /** Below this share of free cells the generated layout is reported as degraded. */
    static final double MIN_FREE_RATIO = 0.5;

    private final SimulationEngine engine;
    private final SchedulerProperties schedulerProperties;
    private final WarehouseMetrics metrics;

    public HealthCheckService(
            SimulationEngine engine,
            SchedulerProperties schedulerProperties,
            @Autowired(required = false) WarehouseMetrics metrics) {
        this.engine = engine;
        this.schedulerProperties = schedulerProperties;
        this.metrics = metrics;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkWarehouse());
        results.add(checkScheduler());
        results.add(checkMetrics());
        return results;
    }

    private HealthStatus checkWarehouse() {
        Warehouse warehouse;
        try {
            warehouse = engine.generateWarehouse(0L);
        } catch (RuntimeException e) {
            log.warn("Warehouse health check failed: {}", e.getMessage());
            return new HealthStatus("warehouse", HealthStatus.Status.DOWN,
                    "Layout generation failed: " + e.getMessage(), Map.of());
        }

        GridMap map = warehouse.map();
        double freeRatio = (double) map.freeCellCount() / map.cellCount();
        var metadata = Map.of(
                "grid", map.width() + "x" + map.height(),
                "resolution", String.valueOf(map.resolution()),
                "freeRatio", String.format("%.2f", freeRatio));

        Cell start = map.toCell(warehouse.startPosition());
        if (map.isOccupied(start)) {
            return new HealthStatus("warehouse", HealthStatus.Status.DOWN,
                    "Start position " + start + " is inside a rack", metadata);
        }
        if (freeRatio < MIN_FREE_RATIO) {
            return new HealthStatus("warehouse", HealthStatus.Status.DEGRADED,
                    "Layout is mostly occupied", metadata);
        }
        return new HealthStatus("warehouse", HealthStatus.Status.UP,
                "Layout generated with " + warehouse.racks().size() + " racks", metadata);
    }

    private HealthStatus checkScheduler() {
        int capacity = schedulerProperties.getMaxQueueSize();
        if (capacity <= 0) {
            return new HealthStatus("scheduler", HealthStatus.Status.DOWN,
                    "Queue capacity must be positive, got " + capacity, Map.of());
        }
        return new HealthStatus("scheduler", HealthStatus.Status.UP,
                "Queue capacity " + capacity,
                Map.of("replanInterval", String.valueOf(schedulerProperties.getReplanInterval())));
    }

    private HealthStatus checkMetrics() {
        if (metrics == null) {
            return new HealthStatus("metrics", HealthStatus.Status.DOWN,
                    "No metrics registry configured", Map.of());
        }
        return new HealthStatus("metrics", HealthStatus.Status.UP,
                "Registry available (" + metrics.registry().getClass().getSimpleName() + ")", Map.of());
    }
}
