package com.questrail.framebus.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Production implementation of FrameBusObservabilitySink that emits logs via SLF4J.
 *
 * <p>Dropped snapshots are logged at WARN for the first occurrence and then
 * once per {@value #DROP_LOG_INTERVAL} drops, with the running total, so a
 * slow subscriber cannot flood the log.</p>
 */
public final class Slf4jFrameBusObservabilitySink implements FrameBusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jFrameBusObservabilitySink.class);

    static final long DROP_LOG_INTERVAL = 1000;

    public static final Slf4jFrameBusObservabilitySink INSTANCE = new Slf4jFrameBusObservabilitySink();

    private final AtomicLong droppedSnapshots = new AtomicLong();

    @Override
    public void onCallbackFailure(CallbackFailureEvent event) {
        log.error("Frame '{}': {} callback {} failed",
            event.frameId(),
            event.policy(),
            event.callbackId(),
            event.cause());
    }

    @Override
    public void onSnapshotDropped(SnapshotDroppedEvent event) {
        long total = droppedSnapshots.incrementAndGet();
        if (total == 1 || total % DROP_LOG_INTERVAL == 0) {
            log.warn("Frame '{}': snapshot queue of callback {} full (capacity {}, {}), {} snapshot(s) dropped so far",
                event.frameId(),
                event.callbackId(),
                event.capacity(),
                event.overflow(),
                total);
        }
    }

    /**
     * Total snapshots reported as dropped through this sink.
     */
    public long droppedSnapshots() {
        return droppedSnapshots.get();
    }

    @Override
    public void onFrameLifecycle(FrameLifecycleEvent event) {
        if (event.kind() == FrameLifecycleEvent.Kind.REPLACED) {
            log.info("Frame '{}' replaced in frame bus", event.frameId());
        } else {
            log.debug("Frame '{}': {}", event.frameId(), event.kind());
        }
    }
}
