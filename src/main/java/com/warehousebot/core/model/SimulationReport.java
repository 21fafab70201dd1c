package com.warehousebot.core.model;

import java.io.Serializable;

/**
 * Outcome of one simulation run.
 */
public record SimulationReport(
    String runId,
    long seed,
    int tasksGenerated,
    int tasksAdmitted,
    int dispatches,
    int pathFallbacks,
    int replans,
    double distanceTravelled,
    double batteryPercent,
    long durationMs,
    SchedulerStatistics statistics
) implements Serializable {
}
