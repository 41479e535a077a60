package com.questrail.framebus.config;

import java.util.Objects;

/**
 * Capacity and overflow behaviour of each threaded subscriber's snapshot queue.
 *
 * @param capacity maximum number of undelivered snapshots per subscriber;
 *                 {@link Integer#MAX_VALUE} means unbounded
 * @param overflow what happens when a snapshot arrives at a full queue
 */
public record SnapshotQueuePolicy(int capacity, OverflowPolicy overflow)
{
    public static final int DEFAULT_CAPACITY = 1024;

    public SnapshotQueuePolicy {
        Objects.requireNonNull(overflow, "overflow");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
    }

    public static SnapshotQueuePolicy defaults() {
        return new SnapshotQueuePolicy(DEFAULT_CAPACITY, OverflowPolicy.DROP_OLDEST);
    }

    public static SnapshotQueuePolicy unbounded() {
        return new SnapshotQueuePolicy(Integer.MAX_VALUE, OverflowPolicy.DROP_NEWEST);
    }

    public static SnapshotQueuePolicy bounded(int capacity, OverflowPolicy overflow) {
        return new SnapshotQueuePolicy(capacity, overflow);
    }

    public boolean isUnbounded() {
        return capacity == Integer.MAX_VALUE;
    }
}
