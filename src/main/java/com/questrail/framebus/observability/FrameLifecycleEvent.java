package com.questrail.framebus.observability;

import java.time.Instant;

/**
 * Record describing a change in a frame's registration or lifetime.
 */
public record FrameLifecycleEvent(
    Instant timestamp,
    String frameId,
    Kind kind
) {
    public enum Kind {
        REGISTERED,
        REPLACED,
        REMOVED,
        CLOSED
    }
}
