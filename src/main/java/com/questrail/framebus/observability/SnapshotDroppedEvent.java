package com.questrail.framebus.observability;

import com.questrail.framebus.config.OverflowPolicy;

import java.time.Instant;

/**
 * Record describing a snapshot discarded by a full subscriber queue.
 */
public record SnapshotDroppedEvent(
    Instant timestamp,
    String frameId,
    long callbackId,
    OverflowPolicy overflow,
    int capacity
) {
}
