package com.warehousebot.core.scheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Binary min-heap of {@link TaskRecord}s that tracks each record's slot, so a record can be
 * removed in O(log n) instead of rebuilding the heap.
 */
final class TaskQueue {

    static final Comparator<TaskRecord> ORDER = Comparator
            .comparingDouble(TaskRecord::key)
            .thenComparing(TaskRecord::arrivalTime)
            .thenComparingLong(TaskRecord::sequence);

    private final List<TaskRecord> heap = new ArrayList<>();

    int size() {
        return heap.size();
    }

    boolean isEmpty() {
        return heap.isEmpty();
    }

    void push(TaskRecord record) {
        if (record.heapIndex >= 0) {
            throw new IllegalStateException("Already queued: " + record);
        }
        heap.add(record);
        record.heapIndex = heap.size() - 1;
        siftUp(record.heapIndex);
    }

    TaskRecord poll() {
        if (heap.isEmpty()) {
            return null;
        }
        TaskRecord top = heap.get(0);
        removeAt(0);
        return top;
    }

    boolean remove(TaskRecord record) {
        int index = record.heapIndex;
        if (index < 0 || index >= heap.size() || heap.get(index) != record) {
            return false;
        }
        removeAt(index);
        return true;
    }

    /**
     * Re-establishes heap order after many keys changed at once. O(n).
     */
    void heapify() {
        for (int i = heap.size() / 2 - 1; i >= 0; i--) {
            siftDown(i);
        }
    }

    /**
     * Queued records in dispatch order. Does not modify the heap.
     */
    List<TaskRecord> ordered() {
        var copy = new ArrayList<>(heap);
        copy.sort(ORDER);
        return copy;
    }

    List<TaskRecord> records() {
        return List.copyOf(heap);
    }

    private void removeAt(int index) {
        TaskRecord removed = heap.get(index);
        int last = heap.size() - 1;
        if (index != last) {
            TaskRecord moved = heap.get(last);
            heap.set(index, moved);
            moved.heapIndex = index;
            heap.remove(last);
            siftUp(index);
            siftDown(moved.heapIndex);
        } else {
            heap.remove(last);
        }
        removed.heapIndex = -1;
    }

    private void siftUp(int index) {
        while (index > 0) {
            int parent = (index - 1) / 2;
            if (ORDER.compare(heap.get(index), heap.get(parent)) >= 0) {
                return;
            }
            swap(index, parent);
            index = parent;
        }
    }

    private void siftDown(int index) {
        int size = heap.size();
        while (true) {
            int left = 2 * index + 1;
            if (left >= size) {
                return;
            }
            int smallest = left;
            int right = left + 1;
            if (right < size && ORDER.compare(heap.get(right), heap.get(left)) < 0) {
                smallest = right;
            }
            if (ORDER.compare(heap.get(smallest), heap.get(index)) >= 0) {
                return;
            }
            swap(index, smallest);
            index = smallest;
        }
    }

    private void swap(int i, int j) {
        TaskRecord a = heap.get(i);
        TaskRecord b = heap.get(j);
        heap.set(i, b);
        heap.set(j, a);
        a.heapIndex = j;
        b.heapIndex = i;
    }
}
