package com.warehousebot.core.engine;

import com.warehousebot.core.environment.Obstacle;
import com.warehousebot.core.environment.Warehouse;
import com.warehousebot.core.events.EventBus;
import com.warehousebot.core.events.WarehouseEvent;
import com.warehousebot.core.metrics.WarehouseMetrics;
import com.warehousebot.core.model.Point;
import com.warehousebot.core.model.SimulationReport;
import com.warehousebot.core.model.Task;
import com.warehousebot.core.model.TaskState;
import com.warehousebot.core.model.TaskType;
import com.warehousebot.core.perception.ObstacleSensor;
import com.warehousebot.core.planning.GridMap;
import com.warehousebot.core.planning.PathPlanner;
import com.warehousebot.core.robot.Robot;
import com.warehousebot.core.robot.RobotProperties;
import com.warehousebot.core.scheduler.MutableClock;
import com.warehousebot.core.scheduler.TaskScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SimulationRunnerTest {

    private static final String RUN_ID = "RUN-TEST-0001";

    private MutableClock clock;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private WarehouseMetrics metrics;
    private RobotProperties robotProperties;
    private SimulationProperties simulationProperties;
    private List<WarehouseEvent> events;

    private TaskScheduler scheduler;
    private Robot robot;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        metrics = new WarehouseMetrics(registry);
        robotProperties = new RobotProperties();
        simulationProperties = new SimulationProperties();
        simulationProperties.setMoveAttempts(2);
        events = new ArrayList<>();
        eventBus.subscribe(RUN_ID, events::add);
    }

    private static Warehouse warehouse(GridMap map, List<Obstacle> obstacles) {
        return new Warehouse(map, map.width() * map.resolution(), map.height() * map.resolution(),
                List.of(), obstacles, List.of(), List.of(), new Point(0.5, 0.5));
    }

    private SimulationRunner runner(Warehouse warehouse, int maxQueueSize, int replanInterval, double detectionProbability) {
        scheduler = new TaskScheduler(maxQueueSize, 0.1, clock);
        robot = new Robot(robotProperties, warehouse.map(), warehouse.startPosition());
        return new SimulationRunner(RUN_ID, warehouse, new PathPlanner(warehouse.map()), scheduler, robot,
                new ObstacleSensor(5.0, detectionProbability, new Random(1)), simulationProperties,
                replanInterval, eventBus, metrics, clock);
    }

    private List<String> eventTypes() {
        return events.stream().map(WarehouseEvent::eventType).toList();
    }

    private List<String> dispatchedIds() {
        return events.stream()
                .filter(e -> e.eventType().equals("task.dispatched"))
                .map(WarehouseEvent::taskId)
                .toList();
    }

    private long count(String eventType) {
        return events.stream().filter(e -> e.eventType().equals(eventType)).count();
    }

    private double counter(String name, String... tags) {
        return registry.find(name).tags(tags).counters().stream()
                .mapToDouble(c -> c.count())
                .sum();
    }

    @Nested
    @DisplayName("open floor")
    class OpenFloorTests {

        @Test
        @DisplayName("completes every task and reports the run")
        void completesAllTasks() {
            var warehouse = warehouse(GridMap.empty(10, 10, 1.0), List.of());
            var tasks = List.of(
                    new Task("T1", TaskType.PICK, new Point(8.5, 8.5), "ITEM-001", null),
                    new Task("T2", TaskType.PLACE, new Point(1.5, 8.5), null, "RACK-01"),
                    Task.of("T3", TaskType.CHARGE, new Point(0.5, 0.5)));

            SimulationReport report = runner(warehouse, 10, 0, 1.0).run(tasks, 99L);

            assertEquals(RUN_ID, report.runId());
            assertEquals(99L, report.seed());
            assertEquals(3, report.tasksGenerated());
            assertEquals(3, report.tasksAdmitted());
            assertEquals(3, report.dispatches());
            assertEquals(0, report.pathFallbacks());
            assertEquals(3, report.statistics().completedCount());
            assertEquals(0, report.statistics().pendingCount());
            assertTrue(report.distanceTravelled() > 0);
            assertEquals(100.0, report.batteryPercent(), 1e-9);
            assertEquals(List.of("T1", "T2", "T3"), dispatchedIds());
            assertTrue(robot.isAt(new Point(0.5, 0.5)));
        }

        @Test
        @DisplayName("publishes lifecycle events in order")
        void eventSequence() {
            var warehouse = warehouse(GridMap.empty(5, 5, 1.0), List.of());

            runner(warehouse, 10, 0, 1.0).run(List.of(Task.of("T1", TaskType.CHARGE, new Point(4.5, 4.5))), 1L);

            assertEquals(List.of("run.started", "task.dispatched", "path.planned", "task.completed", "run.finished"),
                    eventTypes());
            assertTrue(events.stream().allMatch(e -> RUN_ID.equals(e.runId())));
        }

        @Test
        @DisplayName("records dispatch, completion and planning metrics")
        void metrics() {
            var warehouse = warehouse(GridMap.empty(5, 5, 1.0), List.of());

            runner(warehouse, 10, 0, 1.0).run(List.of(
                    Task.of("T1", TaskType.CHARGE, new Point(4.5, 4.5)),
                    Task.of("T2", TaskType.PLACE, new Point(0.5, 4.5))), 1L);

            assertEquals(2.0, counter("warehousebot.tasks.admissions", "result", "admitted"));
            assertEquals(1.0, counter("warehousebot.tasks.dispatched", "type", "CHARGE"));
            assertEquals(1.0, counter("warehousebot.tasks.completed", "type", "PLACE"));
            assertEquals(2, registry.find("warehousebot.planner.duration").tag("outcome", "found").timer().count());
            assertEquals(2, registry.find("warehousebot.planner.path_length").summary().count());
        }

        @Test
        @DisplayName("clears the MDC when the run ends")
        void clearsMdc() {
            var warehouse = warehouse(GridMap.empty(5, 5, 1.0), List.of());

            runner(warehouse, 10, 0, 1.0).run(List.of(Task.of("T1", TaskType.CHARGE, new Point(4.5, 4.5))), 1L);

            assertNull(MDC.get("runId"));
            assertNull(MDC.get("taskId"));
        }

        @Test
        @DisplayName("an empty task list finishes immediately")
        void noTasks() {
            var warehouse = warehouse(GridMap.empty(5, 5, 1.0), List.of());

            SimulationReport report = runner(warehouse, 10, 0, 1.0).run(List.of(), 1L);

            assertEquals(0, report.dispatches());
            assertEquals(List.of("run.started", "run.finished"), eventTypes());
        }
    }

    @Nested
    @DisplayName("admission")
    class AdmissionTests {

        @Test
        @DisplayName("a backlog larger than the queue is fed in as capacity frees up")
        void backlogTopUp() {
            var warehouse = warehouse(GridMap.empty(5, 5, 1.0), List.of());
            var tasks = new ArrayList<Task>();
            for (int i = 1; i <= 5; i++) {
                tasks.add(Task.of("T" + i, TaskType.PLACE, new Point(i - 0.5, 2.5)));
            }

            SimulationReport report = runner(warehouse, 2, 0, 1.0).run(tasks, 1L);

            assertEquals(5, report.tasksAdmitted());
            assertEquals(5, report.statistics().completedCount());
            assertEquals(List.of("T1", "T2", "T3", "T4", "T5"), dispatchedIds());
        }

        @Test
        @DisplayName("duplicate task ids are rejected and counted")
        void duplicatesRejected() {
            var warehouse = warehouse(GridMap.empty(5, 5, 1.0), List.of());
            var task = Task.of("T1", TaskType.PLACE, new Point(2.5, 2.5));

            SimulationReport report = runner(warehouse, 10, 0, 1.0).run(List.of(task, task), 1L);

            assertEquals(1, report.tasksAdmitted());
            assertEquals(1, report.dispatches());
            assertEquals(1.0, counter("warehousebot.tasks.admissions", "result", "rejected"));
        }
    }

    @Nested
    @DisplayName("fallback and cancellation")
    class FallbackTests {

        @Test
        @DisplayName("a start inside a detected obstacle falls back to a direct line and still completes")
        void fallbackCompletes() {
            // touches the robot, so it is always detected with full confidence
            var obstacle = new Obstacle(0, new Point(1.5, 0.5), 2.0, 1.0);
            var warehouse = warehouse(GridMap.empty(5, 5, 1.0), List.of(obstacle));

            SimulationReport report = runner(warehouse, 10, 0, 1.0)
                    .run(List.of(Task.of("T1", TaskType.PLACE, new Point(1.5, 0.5))), 1L);

            assertEquals(1, report.pathFallbacks());
            assertEquals(1, report.statistics().completedCount());
            assertEquals(1, count("path.fallback"));
            assertEquals(1.0, counter("warehousebot.planner.fallbacks"));
            assertEquals(1, registry.find("warehousebot.planner.duration").tag("outcome", "no_path").timer().count());
            assertTrue(robot.isAt(new Point(1.5, 0.5)));
        }

        @Test
        @DisplayName("a target walled in by racks is canceled after the configured attempts")
        void unreachableCanceled() {
            var map = GridMap.parse(1.0,
                    "..........",
                    "..........",
                    "..........",
                    "......###.",
                    "......#.#.",
                    "......###.",
                    "..........");
            var warehouse = warehouse(map, List.of());
            var walledIn = Task.of("T1", TaskType.PICK, new Point(7.5, 4.5));
            var reachable = Task.of("T2", TaskType.PLACE, new Point(2.5, 5.5));

            SimulationReport report = runner(warehouse, 10, 0, 1.0).run(List.of(walledIn, reachable), 1L);

            assertEquals(2, report.pathFallbacks());
            assertEquals(1, report.statistics().canceledCount());
            assertEquals(1, report.statistics().completedCount());
            assertEquals(TaskState.CANCELED, scheduler.stateOf("T1").orElseThrow());
            assertEquals(TaskState.COMPLETED, scheduler.stateOf("T2").orElseThrow());
            assertEquals(1.0, counter("warehousebot.tasks.canceled", "reason", "unreachable"));

            var canceled = events.stream().filter(e -> e.eventType().equals("task.canceled")).findFirst().orElseThrow();
            assertEquals("T1", canceled.taskId());
            assertEquals("unreachable", canceled.payload().get("reason"));
        }

        @Test
        @DisplayName("an item too heavy for the gripper is canceled at the pick location")
        void overweightPickCanceled() {
            robotProperties.setGripperCapacityKg(5.0);
            var warehouse = warehouse(GridMap.empty(10, 10, 1.0), List.of());
            var heavy = new Task("T1", TaskType.PICK, new Point(6.5, 6.5), "ITEM-001", null, 7.5);
            var light = new Task("T2", TaskType.PICK, new Point(2.5, 6.5), "ITEM-002", null, 2.0);

            SimulationReport report = runner(warehouse, 10, 0, 1.0).run(List.of(heavy, light), 1L);

            assertEquals(1, report.statistics().canceledCount());
            assertEquals(1, report.statistics().completedCount());
            assertEquals(TaskState.CANCELED, scheduler.stateOf("T1").orElseThrow());
            assertEquals(TaskState.COMPLETED, scheduler.stateOf("T2").orElseThrow());
            assertEquals("ITEM-002", robot.load());
            assertEquals(1.0, counter("warehousebot.tasks.canceled", "reason", "overweight"));

            var canceled = events.stream().filter(e -> e.eventType().equals("task.canceled")).findFirst().orElseThrow();
            assertEquals("T1", canceled.taskId());
            assertEquals("overweight", canceled.payload().get("reason"));
            assertTrue(report.distanceTravelled() > 0);
        }
    }

    @Nested
    @DisplayName("scheduling")
    class SchedulingTests {

        @Test
        @DisplayName("replans every interval while more than one task is pending")
        void periodicReplan() {
            var warehouse = warehouse(GridMap.empty(6, 6, 1.0), List.of());
            var tasks = new ArrayList<Task>();
            for (int i = 1; i <= 5; i++) {
                tasks.add(Task.of("T" + i, TaskType.PLACE, new Point(i + 0.5, i + 0.5)));
            }

            SimulationReport report = runner(warehouse, 10, 2, 1.0).run(tasks, 1L);

            assertEquals(1, report.replans());
            assertEquals(1, count("scheduler.replanned"));
            assertEquals(1.0, counter("warehousebot.scheduler.replans"));
            assertEquals(5, report.statistics().completedCount());
        }

        @Test
        @DisplayName("replanning sends the robot to the nearest task next")
        void replanPicksNearest() {
            var warehouse = warehouse(GridMap.empty(10, 10, 1.0), List.of());
            var tasks = List.of(
                    Task.of("T1", TaskType.PLACE, new Point(9.5, 9.5)),
                    Task.of("FAR", TaskType.PLACE, new Point(0.5, 0.5)),
                    Task.of("NEAR", TaskType.PLACE, new Point(8.5, 9.5)));

            runner(warehouse, 10, 1, 1.0).run(tasks, 1L);

            assertEquals(List.of("T1", "NEAR", "FAR"), dispatchedIds());
        }

        @Test
        @DisplayName("a low battery escalates pending charge tasks")
        void lowBatteryEscalatesCharging() {
            robotProperties.setMaxSpeed(1.0);
            robotProperties.setBatteryCapacity(100);
            robotProperties.setBatteryDischargeRate(10);
            var warehouse = warehouse(GridMap.empty(10, 10, 1.0), List.of());
            var tasks = List.of(
                    Task.of("T1", TaskType.PLACE, new Point(9.5, 0.5)),
                    Task.of("T2", TaskType.PLACE, new Point(9.5, 1.5)),
                    Task.of("C1", TaskType.CHARGE, new Point(9.5, 2.5)));

            SimulationReport report = runner(warehouse, 10, 0, 1.0).run(tasks, 1L);

            assertEquals(List.of("T1", "C1", "T2"), dispatchedIds());
            assertEquals(0, scheduler.recordOf("C1").orElseThrow().priority());
            assertEquals(90.0, report.batteryPercent(), 1e-6);
        }
    }
}
