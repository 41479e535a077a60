package com.questrail.framebus.observability;

/**
 * No-op implementation of FrameBusObservabilitySink.
 */
public final class NullObservabilitySink implements FrameBusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCallbackFailure(CallbackFailureEvent event) {}

    @Override
    public void onSnapshotDropped(SnapshotDroppedEvent event) {}

    @Override
    public void onFrameLifecycle(FrameLifecycleEvent event) {}
}
