package com.warehousebot.core.engine;

import com.warehousebot.core.environment.Warehouse;
import com.warehousebot.core.events.EventBus;
import com.warehousebot.core.events.WarehouseEvent;
import com.warehousebot.core.logging.MdcContext;
import com.warehousebot.core.metrics.WarehouseMetrics;
import com.warehousebot.core.model.ObstacleDetection;
import com.warehousebot.core.model.Point;
import com.warehousebot.core.model.SimulationReport;
import com.warehousebot.core.model.Task;
import com.warehousebot.core.model.TaskType;
import com.warehousebot.core.perception.ObstacleSensor;
import com.warehousebot.core.planning.PathPlanner;
import com.warehousebot.core.robot.Robot;
import com.warehousebot.core.scheduler.TaskRecord;
import com.warehousebot.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The dispatch loop of one simulation run.
 * <p>
 * Keeps the scheduler topped up from a backlog, then repeatedly takes the next task, senses
 * nearby obstacles, plans a path (falling back to a direct line), drives the robot and reports
 * completion. A task the robot cannot reach within {@code moveAttempts} plans is canceled, and so
 * is a PICK whose item is too heavy for the gripper.
 * Every {@code replanInterval} dispatches the queue is re-ranked around the robot's position.
 * <p>
 * Single-threaded: the runner is the only owner of its scheduler, planner and robot.
 */
public class SimulationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    static final int URGENT_PRIORITY = 0;

    private final String runId;
    private final Warehouse warehouse;
    private final PathPlanner planner;
    private final TaskScheduler scheduler;
    private final Robot robot;
    private final ObstacleSensor sensor;
    private final SimulationProperties properties;
    private final int replanInterval;
    private final EventBus eventBus;
    private final WarehouseMetrics metrics;
    private final Clock clock;

    private int admitted;
    private int dispatches;
    private int fallbacks;
    private int replans;

    public SimulationRunner(String runId, Warehouse warehouse, PathPlanner planner, TaskScheduler scheduler,
                            Robot robot, ObstacleSensor sensor, SimulationProperties properties,
                            int replanInterval, EventBus eventBus, WarehouseMetrics metrics, Clock clock) {
        this.runId = runId;
        this.warehouse = warehouse;
        this.planner = planner;
        this.scheduler = scheduler;
        this.robot = robot;
        this.sensor = sensor;
        this.properties = properties;
        this.replanInterval = replanInterval;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public SimulationReport run(List<Task> tasks, long seed) {
        Instant started = clock.instant();
        MdcContext.setRun(runId);
        try {
            log.info("Run {} starting: {} tasks, robot at ({}, {})", runId, tasks.size(),
                    robot.position().x(), robot.position().y());
            publish("run.started", null, Map.of("tasks", tasks.size(), "seed", seed));

            Deque<Task> backlog = new ArrayDeque<>(tasks);
            topUp(backlog);

            Optional<Task> next;
            while ((next = scheduler.next()).isPresent()) {
                dispatch(next.get());
                dispatches++;
                topUp(backlog);
                escalateChargingIfLow();
                if (replanInterval > 0 && dispatches % replanInterval == 0 && scheduler.pendingCount() > 1) {
                    replan();
                }
            }

            long durationMs = Duration.between(started, clock.instant()).toMillis();
            var report = new SimulationReport(runId, seed, tasks.size(), admitted, dispatches, fallbacks, replans,
                    robot.distanceTravelled(), robot.batteryPercent(), durationMs, scheduler.statistics());
            log.info("Run {} finished: {} completed, {} canceled, {} fallbacks, {} m travelled",
                    runId, report.statistics().completedCount(), report.statistics().canceledCount(),
                    fallbacks, String.format("%.1f", robot.distanceTravelled()));
            publish("run.finished", null, Map.of(
                    "completed", report.statistics().completedCount(),
                    "canceled", report.statistics().canceledCount(),
                    "durationMs", durationMs));
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    void dispatch(Task task) {
        MdcContext.setTask(runId, task.id(), task.type().name());
        try {
            metrics.recordDispatch(task.type().name());
            publish("task.dispatched", task.id(), Map.of("type", task.type().name()));

            if (!driveTo(task)) {
                log.warn("Canceling {}: target ({}, {}) unreachable after {} attempts", task.id(),
                        task.position().x(), task.position().y(), properties.getMoveAttempts());
                cancel(task, "unreachable");
                return;
            }

            if (!robot.execute(task)) {
                if (task.type() == TaskType.PICK && !robot.canLift(task)) {
                    log.warn("Canceling {}: {} weighs {} kg, over the gripper capacity", task.id(),
                            task.itemId(), task.weightKg());
                    cancel(task, "overweight");
                    return;
                }
                log.debug("{} had no effect (load={})", task.type(), robot.load());
            }
            scheduler.complete(task);
            double waitSeconds = scheduler.recordOf(task.id())
                    .map(SimulationRunner::waitSeconds)
                    .orElse(0.0);
            metrics.recordCompletion(task.type().name(), waitSeconds);
            publish("task.completed", task.id(), Map.of("waitSeconds", waitSeconds,
                    "battery", robot.batteryPercent()));
        } finally {
            MdcContext.clearTask();
        }
    }

    private void cancel(Task task, String reason) {
        scheduler.cancel(task);
        metrics.recordCancellation(task.type().name(), reason);
        publish("task.canceled", task.id(), Map.of("reason", reason));
    }

    private boolean driveTo(Task task) {
        int attempts = Math.max(1, properties.getMoveAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Point from = robot.position();
            List<ObstacleDetection> detections =
                    sensor.detect(from, warehouse.obstaclesWithin(from, sensor.range()));

            long t0 = System.nanoTime();
            List<Point> path = planner.plan(from, task.position(), detections);
            long elapsed = System.nanoTime() - t0;

            if (path.isEmpty()) {
                metrics.recordPlanningDuration(elapsed, "no_path");
                metrics.incrementPathFallbacks();
                fallbacks++;
                log.warn("No path to {} from ({}, {}) with {} detections, using direct line",
                        task.id(), from.x(), from.y(), detections.size());
                publish("path.fallback", task.id(), Map.of("detections", detections.size()));
                path = PathPlanner.directLine(from, task.position());
            } else {
                double length = PathPlanner.pathLength(path);
                metrics.recordPlanningDuration(elapsed, "found");
                metrics.recordPathLength(length);
                publish("path.planned", task.id(), Map.of("waypoints", path.size(), "length", length,
                        "detections", detections.size()));
            }

            if (robot.followPath(path)) {
                return true;
            }
            log.info("Robot blocked at ({}, {}) on the way to {}, replanning (attempt {}/{})",
                    robot.position().x(), robot.position().y(), task.id(), attempt, attempts);
        }
        return false;
    }

    private void topUp(Deque<Task> backlog) {
        while (!backlog.isEmpty() && scheduler.pendingCount() < scheduler.maxQueueSize()) {
            Task task = backlog.poll();
            int priority = task.type() == TaskType.CHARGE && isBatteryLow()
                    ? URGENT_PRIORITY : TaskScheduler.DEFAULT_PRIORITY;
            boolean accepted = scheduler.add(task, priority);
            metrics.recordAdmission(task.type().name(), accepted);
            if (accepted) {
                admitted++;
            }
        }
    }

    private void escalateChargingIfLow() {
        if (!isBatteryLow()) {
            return;
        }
        for (Task task : scheduler.pending()) {
            if (task.type() != TaskType.CHARGE) continue;
            boolean urgent = scheduler.recordOf(task.id())
                    .map(r -> r.priority() == URGENT_PRIORITY)
                    .orElse(true);
            if (!urgent && scheduler.reprioritize(task, URGENT_PRIORITY)) {
                log.info("Battery at {}%, escalating {}", String.format("%.0f", robot.batteryPercent()), task.id());
            }
        }
    }

    private void replan() {
        scheduler.replan(robot.position());
        replans++;
        metrics.incrementReplans();
        var payload = new HashMap<String, Object>();
        payload.put("pending", scheduler.pendingCount());
        payload.put("x", robot.position().x());
        payload.put("y", robot.position().y());
        publish("scheduler.replanned", null, payload);
    }

    private boolean isBatteryLow() {
        return robot.batteryPercent() < properties.getLowBatteryPercent();
    }

    private static double waitSeconds(TaskRecord record) {
        if (record.completionTime() == null) {
            return 0.0;
        }
        return Duration.between(record.arrivalTime(), record.completionTime()).toNanos() / 1_000_000_000.0;
    }

    private void publish(String type, String taskId, Map<String, Object> payload) {
        eventBus.publish(new WarehouseEvent(type, runId, taskId, payload, clock.instant()));
    }
}
