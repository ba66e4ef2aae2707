package com.accessmonitoring.domain.activity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO hand-off between the activity recorder and the activity monitor.
 *
 * <p>Producers never block: when the queue is full the oldest entry is discarded to make
 * room and {@link #droppedCount()} is incremented. Under sustained overload the monitor
 * therefore skips activities; they remain in the {@link ActivityLog} for the batch
 * detectors.
 */
public class BoundedActivityQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<Activity> items;
    private final int capacity;
    private final AtomicLong dropped = new AtomicLong();

    public BoundedActivityQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive");
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueue an activity, evicting the oldest one if the queue is full.
     *
     * @return the evicted activity, or {@code null} if nothing was dropped
     */
    public Activity offer(Activity activity) {
        lock.lock();
        try {
            Activity evicted = null;
            if (items.size() >= capacity) {
                evicted = items.pollFirst();
                dropped.incrementAndGet();
            }
            items.addLast(activity);
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return everything currently queued, oldest first.
     */
    public List<Activity> drain() {
        lock.lock();
        try {
            List<Activity> drained = new ArrayList<>(items);
            items.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return dropped.get();
    }
}
