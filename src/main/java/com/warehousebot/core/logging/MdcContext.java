package com.warehousebot.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing simulation MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setTask(String runId, String taskId, String taskType) {
        MDC.put("runId", runId);
        MDC.put("taskId", taskId);
        MDC.put("taskType", taskType);
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("taskType");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("taskId");
        MDC.remove("taskType");
    }
}
