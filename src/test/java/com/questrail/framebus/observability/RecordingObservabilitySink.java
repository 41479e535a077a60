package com.questrail.framebus.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements FrameBusObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onCallbackFailure(CallbackFailureEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSnapshotDropped(SnapshotDroppedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onFrameLifecycle(FrameLifecycleEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized List<FrameLifecycleEvent.Kind> lifecycleKinds(String frameId) {
        return events.stream()
            .filter(e -> e instanceof FrameLifecycleEvent)
            .map(e -> (FrameLifecycleEvent) e)
            .filter(e -> e.frameId().equals(frameId))
            .map(FrameLifecycleEvent::kind)
            .collect(Collectors.toList());
    }
}
