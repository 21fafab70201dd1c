package com.warehousebot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning and dispatch.
 */
@Service
public class WarehouseMetrics {

    private final MeterRegistry registry;

    public WarehouseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    /**
     * @param outcome "found" or "no_path"
     */
    public void recordPlanningDuration(long nanos, String outcome) {
        Timer.builder("warehousebot.planner.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    public void recordPathLength(double meters) {
        DistributionSummary.builder("warehousebot.planner.path_length")
                .baseUnit("meters")
                .register(registry)
                .record(meters);
    }

    public void incrementPathFallbacks() {
        Counter.builder("warehousebot.planner.fallbacks")
                .description("Queries answered with the direct-line fallback")
                .register(registry)
                .increment();
    }

    public void recordAdmission(String taskType, boolean admitted) {
        Counter.builder("warehousebot.tasks.admissions")
                .tag("type", taskType)
                .tag("result", admitted ? "admitted" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordDispatch(String taskType) {
        Counter.builder("warehousebot.tasks.dispatched")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    public void recordCompletion(String taskType, double waitSeconds) {
        Counter.builder("warehousebot.tasks.completed")
                .tag("type", taskType)
                .register(registry)
                .increment();

        DistributionSummary.builder("warehousebot.tasks.wait_seconds")
                .description("Time from arrival to completion")
                .baseUnit("seconds")
                .register(registry)
                .record(waitSeconds);
    }

    public void recordCancellation(String taskType, String reason) {
        Counter.builder("warehousebot.tasks.canceled")
                .tag("type", taskType)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementReplans() {
        Counter.builder("warehousebot.scheduler.replans")
                .register(registry)
                .increment();
    }
}
