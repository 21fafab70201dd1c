package com.warehousebot.core.scheduler;

import com.warehousebot.core.model.Task;
import com.warehousebot.core.model.TaskState;

import java.time.Instant;

/**
 * Scheduler-side wrapper around a {@link Task}: its ordering key and lifecycle bookkeeping.
 * <p>
 * Ordering is {@code (key, arrivalTime, sequence)}. {@code key} starts out equal to the
 * admitted priority and is replaced by a distance-weighted value on replan.
 */
public final class TaskRecord {

    private final Task task;
    private int priority;
    private double key;
    private Instant arrivalTime;
    private long sequence;
    private TaskState state = TaskState.QUEUED;
    private Instant dispatchTime;
    private Instant completionTime;

    /** Slot in the owning {@link TaskQueue}, -1 when not queued. */
    int heapIndex = -1;

    TaskRecord(Task task, int priority, Instant arrivalTime, long sequence) {
        this.task = task;
        this.priority = priority;
        this.key = priority;
        this.arrivalTime = arrivalTime;
        this.sequence = sequence;
    }

    public Task task() { return task; }
    public int priority() { return priority; }
    public double key() { return key; }
    public Instant arrivalTime() { return arrivalTime; }
    public long sequence() { return sequence; }
    public TaskState state() { return state; }
    public Instant dispatchTime() { return dispatchTime; }
    public Instant completionTime() { return completionTime; }

    public boolean isQueued() {
        return heapIndex >= 0;
    }

    void readmit(int newPriority, Instant newArrival, long newSequence) {
        this.priority = newPriority;
        this.key = newPriority;
        this.arrivalTime = newArrival;
        this.sequence = newSequence;
        this.dispatchTime = null;
    }

    void setKey(double key) { this.key = key; }
    void markDispatched(Instant at) { this.dispatchTime = at; }

    void markCompleted(Instant at) {
        this.state = TaskState.COMPLETED;
        this.completionTime = at;
    }

    void markCanceled() {
        this.state = TaskState.CANCELED;
    }

    @Override
    public String toString() {
        return "TaskRecord(" + task.id() + ", priority=" + priority + ", key=" + key + ", state=" + state + ")";
    }
}
