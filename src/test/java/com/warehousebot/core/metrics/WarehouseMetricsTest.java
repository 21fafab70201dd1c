package com.warehousebot.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WarehouseMetricsTest {

    private SimpleMeterRegistry registry;
    private WarehouseMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WarehouseMetrics(registry);
    }

    @Test
    @DisplayName("recordPlanningDuration records by outcome tag")
    void recordPlanningDuration() {
        metrics.recordPlanningDuration(1_500_000, "found");
        metrics.recordPlanningDuration(2_000_000, "found");
        metrics.recordPlanningDuration(500_000, "no_path");

        var found = registry.find("warehousebot.planner.duration").tag("outcome", "found").timer();
        var noPath = registry.find("warehousebot.planner.duration").tag("outcome", "no_path").timer();

        assertNotNull(found);
        assertNotNull(noPath);
        assertEquals(2, found.count());
        assertEquals(1, noPath.count());
    }

    @Test
    @DisplayName("recordPathLength records a distribution summary")
    void recordPathLength() {
        metrics.recordPathLength(4.0);
        metrics.recordPathLength(6.0);

        var summary = registry.find("warehousebot.planner.path_length").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(10.0, summary.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordAdmission splits admitted and rejected")
    void recordAdmission() {
        metrics.recordAdmission("PICK", true);
        metrics.recordAdmission("PICK", true);
        metrics.recordAdmission("PICK", false);

        var admitted = registry.find("warehousebot.tasks.admissions")
                .tag("type", "PICK").tag("result", "admitted").counter();
        var rejected = registry.find("warehousebot.tasks.admissions")
                .tag("type", "PICK").tag("result", "rejected").counter();

        assertNotNull(admitted);
        assertNotNull(rejected);
        assertEquals(2.0, admitted.count());
        assertEquals(1.0, rejected.count());
    }

    @Test
    @DisplayName("recordCompletion increments counter and records wait time")
    void recordCompletion() {
        metrics.recordCompletion("CHARGE", 3.5);

        var counter = registry.find("warehousebot.tasks.completed").tag("type", "CHARGE").counter();
        var wait = registry.find("warehousebot.tasks.wait_seconds").summary();

        assertNotNull(counter);
        assertEquals(1.0, counter.count());
        assertNotNull(wait);
        assertEquals(3.5, wait.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordCancellation tags the reason")
    void recordCancellation() {
        metrics.recordCancellation("PLACE", "unreachable");

        var counter = registry.find("warehousebot.tasks.canceled")
                .tag("type", "PLACE").tag("reason", "unreachable").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("fallback, dispatch and replan counters increment")
    void simpleCounters() {
        metrics.incrementPathFallbacks();
        metrics.recordDispatch("PICK");
        metrics.incrementReplans();
        metrics.incrementReplans();

        assertEquals(1.0, registry.find("warehousebot.planner.fallbacks").counter().count());
        assertEquals(1.0, registry.find("warehousebot.tasks.dispatched").tag("type", "PICK").counter().count());
        assertEquals(2.0, registry.find("warehousebot.scheduler.replans").counter().count());
    }
}
