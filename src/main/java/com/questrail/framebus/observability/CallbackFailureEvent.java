package com.questrail.framebus.observability;

import com.questrail.framebus.api.CallbackPolicy;

import java.time.Instant;

/**
 * Record describing a subscriber callback that threw.
 */
public record CallbackFailureEvent(
    Instant timestamp,
    String frameId,
    long callbackId,
    CallbackPolicy policy,
    Throwable cause
) {
}
