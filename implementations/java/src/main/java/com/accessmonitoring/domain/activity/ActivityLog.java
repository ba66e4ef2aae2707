package com.accessmonitoring.domain.activity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only activity log shared by the request path and the monitoring workers.
 *
 * <p>Lock granularity: one {@link ReentrantReadWriteLock} for the whole log. Appends take
 * the write lock; window queries take the read lock only long enough to copy the
 * matching entries, and callers analyse the returned copy without holding any lock.
 *
 * <p>Entries older than the retention period are pruned from the head on append.
 * Entries are kept in append order, which follows timestamp order up to the small
 * skew of concurrent producers; window scans stop once they are more than
 * {@link #ORDERING_SLACK} past the window start.
 */
public class ActivityLog {

    static final Duration ORDERING_SLACK = Duration.ofSeconds(5);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ArrayDeque<Activity> entries = new ArrayDeque<>();
    private final Duration retention;

    public ActivityLog(Duration retention) {
        this.retention = retention;
    }

    public void append(Activity activity) {
        lock.writeLock().lock();
        try {
            entries.addLast(activity);
            Instant cutoff = activity.getTimestamp().minus(retention);
            while (!entries.isEmpty() && entries.peekFirst().getTimestamp().isBefore(cutoff)) {
                entries.pollFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copy of all activities with {@code from <= timestamp <= to}, oldest first.
     */
    public List<Activity> window(Instant from, Instant to) {
        return collect(null, from, to);
    }

    /**
     * Copy of one user's activities with {@code from <= timestamp <= to}, oldest first.
     */
    public List<Activity> windowForUser(String userId, Instant from, Instant to) {
        return collect(userId, from, to);
    }

    public List<Activity> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Activity> collect(String userId, Instant from, Instant to) {
        Instant stopBefore = from.minus(ORDERING_SLACK);
        List<Activity> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            Iterator<Activity> it = entries.descendingIterator();
            while (it.hasNext()) {
                Activity activity = it.next();
                Instant ts = activity.getTimestamp();
                if (ts.isBefore(stopBefore)) {
                    break;
                }
                if (ts.isBefore(from) || ts.isAfter(to)) {
                    continue;
                }
                if (userId == null || userId.equals(activity.getUserId())) {
                    matched.add(activity);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        Collections.reverse(matched);
        return matched;
    }
}
