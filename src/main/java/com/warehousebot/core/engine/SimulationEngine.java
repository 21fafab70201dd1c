package com.warehousebot.core.engine;

import com.warehousebot.core.environment.Warehouse;
import com.warehousebot.core.environment.WarehouseGenerator;
import com.warehousebot.core.environment.WarehouseProperties;
import com.warehousebot.core.events.EventBus;
import com.warehousebot.core.metrics.WarehouseMetrics;
import com.warehousebot.core.model.SimulationReport;
import com.warehousebot.core.model.Task;
import com.warehousebot.core.perception.ObstacleSensor;
import com.warehousebot.core.planning.PathPlanner;
import com.warehousebot.core.planning.PlannerProperties;
import com.warehousebot.core.robot.Robot;
import com.warehousebot.core.robot.RobotProperties;
import com.warehousebot.core.scheduler.SchedulerProperties;
import com.warehousebot.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires a warehouse, planner, scheduler and robot together for one seeded run.
 * <p>
 * Every run gets its own components; only the event bus and metrics are shared. Warehouse
 * generation, task generation and sensor noise all draw from one {@link Random} seeded with the
 * run's seed, so the same seed replays the same run.
 */
@Service
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final WarehouseProperties warehouseProperties;
    private final PlannerProperties plannerProperties;
    private final SchedulerProperties schedulerProperties;
    private final RobotProperties robotProperties;
    private final SimulationProperties simulationProperties;
    private final EventBus eventBus;
    private final WarehouseMetrics metrics;
    private final Clock clock;

    public SimulationEngine(WarehouseProperties warehouseProperties, PlannerProperties plannerProperties,
                            SchedulerProperties schedulerProperties, RobotProperties robotProperties,
                            SimulationProperties simulationProperties, EventBus eventBus,
                            WarehouseMetrics metrics, Clock clock) {
        this.warehouseProperties = warehouseProperties;
        this.plannerProperties = plannerProperties;
        this.schedulerProperties = schedulerProperties;
        this.robotProperties = robotProperties;
        this.simulationProperties = simulationProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs with the configured seed and task count.
     */
    public SimulationReport runSimulation() {
        return runSimulation(simulationProperties.getSeed(), simulationProperties.getTaskCount());
    }

    public SimulationReport runSimulation(long seed, int taskCount) {
        return runSimulation(generateRunId(), seed, taskCount);
    }

    /**
     * @param runId     the run ID to tag events and logs with
     * @param seed      seed for every random draw in the run
     * @param taskCount number of task draws; a draw whose type has no target in the
     *                  warehouse yields no task
     */
    public SimulationReport runSimulation(String runId, long seed, int taskCount) {
        if (taskCount < 0) {
            throw new IllegalArgumentException("Task count must not be negative: " + taskCount);
        }
        var random = new Random(seed);
        Warehouse warehouse = generateWarehouse(random);
        List<Task> tasks = warehouse.generateTasks(taskCount, random);
        log.info("Run {} (seed {}): generated {} of {} requested tasks", runId, seed, tasks.size(), taskCount);

        var runner = new SimulationRunner(runId, warehouse,
                plannerFor(warehouse),
                new TaskScheduler(schedulerProperties, clock),
                new Robot(robotProperties, warehouse.map(), warehouse.startPosition()),
                new ObstacleSensor(robotProperties.getSensor().getRange(),
                        robotProperties.getSensor().getDetectionProbability(), random),
                simulationProperties,
                schedulerProperties.getReplanInterval(),
                eventBus, metrics, clock);
        return runner.run(tasks, seed);
    }

    public Warehouse generateWarehouse(long seed) {
        return generateWarehouse(new Random(seed));
    }

    private Warehouse generateWarehouse(Random random) {
        return new WarehouseGenerator(warehouseProperties, plannerProperties.getResolution()).generate(random);
    }

    public PathPlanner plannerFor(Warehouse warehouse) {
        return new PathPlanner(warehouse.map(), plannerProperties);
    }

    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%04d", year, count);
    }
}
