package com.questrail.framebus.observability;

/**
 * Main interface for receiving frame bus observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called from publishing threads and delivery workers and must be
 * thread-safe and non-blocking.</p>
 */
public interface FrameBusObservabilitySink {
    /**
     * Called when a direct or threaded subscriber callback throws.
     * @param event the failure details
     */
    void onCallbackFailure(CallbackFailureEvent event);

    /**
     * Called when a bounded snapshot queue discards a snapshot.
     * @param event the drop details
     */
    void onSnapshotDropped(SnapshotDroppedEvent event);

    /**
     * Called when a frame is registered, replaced, removed or closed.
     * @param event the lifecycle event
     */
    void onFrameLifecycle(FrameLifecycleEvent event);
}
