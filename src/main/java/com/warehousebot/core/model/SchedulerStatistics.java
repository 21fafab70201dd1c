package com.warehousebot.core.model;

import java.io.Serializable;

/**
 * Snapshot of scheduler accounting.
 *
 * @param completedCount       tasks moved to COMPLETED
 * @param pendingCount         tasks waiting in the dispatch queue
 * @param canceledCount        tasks moved to CANCELED
 * @param avgCompletionSeconds mean time from dispatch to completion
 * @param avgWaitSeconds       mean time from (latest) arrival to completion
 * @param throughput           completed tasks per second since the scheduler started
 */
public record SchedulerStatistics(
    int completedCount,
    int pendingCount,
    int canceledCount,
    double avgCompletionSeconds,
    double avgWaitSeconds,
    double throughput
) implements Serializable {
}
