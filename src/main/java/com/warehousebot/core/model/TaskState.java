package com.warehousebot.core.model;

/**
 * Lifecycle state of a task owned by the scheduler.
 * A dispatched task stays QUEUED until it is completed or canceled.
 */
public enum TaskState {
    QUEUED,
    COMPLETED,
    CANCELED;

    public boolean isTerminal() {
        return this != QUEUED;
    }
}
