package com.warehousebot.core.scheduler;

import com.warehousebot.core.model.Point;
import com.warehousebot.core.model.SchedulerStatistics;
import com.warehousebot.core.model.Task;
import com.warehousebot.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Priority dispatch queue for warehouse tasks.
 * <p>
 * Tasks are dispatched by smallest {@code (priority, arrival time)}; lower priority values are
 * more urgent and equal priorities are served first-come first-served. Admitted tasks are owned
 * here until they are completed or canceled; a dispatched task is no longer queued but is still
 * active, so it can be completed, canceled or reprioritized.
 * <p>
 * Every failure (full queue, unknown or inactive task) is reported as a {@code false} return
 * and leaves the scheduler unchanged.
 * <p>
 * Completed and canceled records are kept for the scheduler's lifetime: {@link #recordOf(String)}
 * serves their timings after completion and their ids stay rejected by {@link #add(Task)}. Memory
 * therefore grows with every admitted task, so an instance is meant to live for one bounded run.
 * <p>
 * Not thread-safe: one control loop owns an instance.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    public static final int DEFAULT_PRIORITY = 1;

    private final int maxQueueSize;
    private final double replanWeight;
    private final Clock clock;
    private final Instant startTime;

    private final Map<String, TaskRecord> records = new HashMap<>();
    private final TaskQueue queue = new TaskQueue();
    private TaskRecord current;
    private long sequence;

    private int completedCount;
    private int canceledCount;
    private double totalServiceSeconds;
    private double totalWaitSeconds;

    public TaskScheduler(SchedulerProperties properties, Clock clock) {
        this(properties.getMaxQueueSize(), properties.getReplanWeight(), clock);
    }

    public TaskScheduler(int maxQueueSize, double replanWeight, Clock clock) {
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive: " + maxQueueSize);
        }
        this.maxQueueSize = maxQueueSize;
        this.replanWeight = replanWeight;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public boolean add(Task task) {
        return add(task, DEFAULT_PRIORITY);
    }

    /**
     * Admits a task with the current time as its arrival time.
     *
     * @return false if the queue is full or the task id was already admitted
     */
    public boolean add(Task task, int priority) {
        if (queue.size() >= maxQueueSize) {
            log.debug("Rejected {}: queue full ({}/{})", task.id(), queue.size(), maxQueueSize);
            return false;
        }
        if (records.containsKey(task.id())) {
            log.debug("Rejected {}: already admitted ({})", task.id(), records.get(task.id()).state());
            return false;
        }
        var record = new TaskRecord(task, priority, clock.instant(), sequence++);
        records.put(task.id(), record);
        queue.push(record);
        log.debug("Admitted {} [{}] priority={}", task.id(), task.type(), priority);
        return true;
    }

    public int addAll(List<Task> tasks) {
        int added = 0;
        for (Task task : tasks) {
            if (add(task)) added++;
        }
        return added;
    }

    /**
     * Admits each task with the priority at the same index.
     *
     * @return number of tasks admitted; capacity may run out partway through
     */
    public int addAll(List<Task> tasks, List<Integer> priorities) {
        if (priorities.size() != tasks.size()) {
            throw new IllegalArgumentException("Got " + tasks.size() + " tasks but " + priorities.size() + " priorities");
        }
        int added = 0;
        for (int i = 0; i < tasks.size(); i++) {
            if (add(tasks.get(i), priorities.get(i))) added++;
        }
        return added;
    }

    /**
     * Removes and returns the most urgent queued task, which becomes the current task.
     * Returns empty, and clears the current task, when nothing is queued.
     */
    public Optional<Task> next() {
        TaskRecord record = queue.poll();
        current = record;
        if (record == null) {
            return Optional.empty();
        }
        record.markDispatched(clock.instant());
        log.debug("Dispatching {} [{}] key={}", record.task().id(), record.task().type(), record.key());
        return Optional.of(record.task());
    }

    /**
     * Moves an active task to COMPLETED and records its wait time ({@code completion - arrival}).
     */
    public boolean complete(Task task) {
        TaskRecord record = activeRecord(task);
        if (record == null) {
            return false;
        }
        Instant now = clock.instant();
        queue.remove(record);
        record.markCompleted(now);
        clearCurrent(record);

        Instant dispatched = record.dispatchTime() != null ? record.dispatchTime() : now;
        totalServiceSeconds += seconds(dispatched, now);
        totalWaitSeconds += seconds(record.arrivalTime(), now);
        completedCount++;
        log.debug("Completed {} after {}s", task.id(), seconds(record.arrivalTime(), now));
        return true;
    }

    public boolean cancel(Task task) {
        TaskRecord record = activeRecord(task);
        if (record == null) {
            return false;
        }
        queue.remove(record);
        record.markCanceled();
        clearCurrent(record);
        canceledCount++;
        log.debug("Canceled {}", task.id());
        return true;
    }

    /**
     * Re-admits an active task with a new priority and a fresh arrival time.
     * <p>
     * The fresh arrival time restarts the task's wait-time accounting. A task that was already
     * dispatched goes back into the queue, which fails if the queue is full.
     */
    public boolean reprioritize(Task task, int newPriority) {
        TaskRecord record = activeRecord(task);
        if (record == null) {
            return false;
        }
        boolean wasQueued = queue.remove(record);
        if (!wasQueued && queue.size() >= maxQueueSize) {
            log.debug("Cannot requeue {}: queue full ({}/{})", task.id(), queue.size(), maxQueueSize);
            return false;
        }
        record.readmit(newPriority, clock.instant(), sequence++);
        clearCurrent(record);
        queue.push(record);
        log.debug("Reprioritized {} to {}", task.id(), newPriority);
        return true;
    }

    /**
     * Re-keys every queued task by {@code distance(task, robot) * priority * weight}, using the
     * priority the task was admitted with, and restores heap order.
     */
    public void replan(Point robotPosition) {
        for (TaskRecord record : queue.records()) {
            double distance = record.task().position().distanceTo(robotPosition);
            record.setKey(distance * record.priority() * replanWeight);
        }
        queue.heapify();
        log.debug("Replanned {} queued tasks around ({}, {})", queue.size(), robotPosition.x(), robotPosition.y());
    }

    public SchedulerStatistics statistics() {
        double elapsed = seconds(startTime, clock.instant());
        return new SchedulerStatistics(
                completedCount,
                queue.size(),
                canceledCount,
                completedCount > 0 ? totalServiceSeconds / completedCount : 0.0,
                completedCount > 0 ? totalWaitSeconds / completedCount : 0.0,
                elapsed > 0 ? completedCount / elapsed : 0.0);
    }

    public Optional<Task> current() {
        return Optional.ofNullable(current).map(TaskRecord::task);
    }

    public Optional<TaskState> stateOf(String taskId) {
        return Optional.ofNullable(records.get(taskId)).map(TaskRecord::state);
    }

    public Optional<TaskRecord> recordOf(String taskId) {
        return Optional.ofNullable(records.get(taskId));
    }

    /**
     * Queued tasks in the order {@link #next()} would return them.
     */
    public List<Task> pending() {
        return queue.ordered().stream().map(TaskRecord::task).toList();
    }

    public int pendingCount() {
        return queue.size();
    }

    public int maxQueueSize() {
        return maxQueueSize;
    }

    private TaskRecord activeRecord(Task task) {
        TaskRecord record = records.get(task.id());
        if (record == null || record.state().isTerminal()) {
            log.debug("Ignoring {}: not active", task.id());
            return null;
        }
        return record;
    }

    private void clearCurrent(TaskRecord record) {
        if (current == record) {
            current = null;
        }
    }

    private static double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / 1_000_000_000.0;
    }

    @Override
    public String toString() {
        return "TaskScheduler(active=" + (records.size() - completedCount - canceledCount)
                + ", completed=" + completedCount + ", pending=" + queue.size() + ")";
    }
}
