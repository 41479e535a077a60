package com.questrail.framebus.registry;

import com.questrail.framebus.api.Frame;
import com.questrail.framebus.observability.FrameBusObservabilitySink;
import com.questrail.framebus.observability.FrameLifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * FrameBus
 * -----------------------------------------------------------------------------
 * Named registry of live frame instances, owned by a {@link BusContext}.
 *
 * <h2>References</h2>
 * Every entry holds one reference on its frame: {@link #register} retains the
 * new frame, replacing or removing an entry releases the old one. Releases
 * happen after the bus lock is dropped, because the last release closes the
 * frame and joins its workers.
 *
 * <h2>Iteration</h2>
 * {@link #forEach} runs under the bus lock in registration order. The action
 * must not call back into this bus.
 */
public final class FrameBus
{
    private static final Logger log = LoggerFactory.getLogger(FrameBus.class);

    private final FrameBusObservabilitySink sink;

    private final Object lock = new Object();
    private final Map<String, Frame> frames = new LinkedHashMap<>();

    public FrameBus(FrameBusObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Inserts or replaces the mapping for {@code name}.
     *
     * @throws IllegalStateException if {@code frame} is already closed
     */
    public void register(String name, Frame frame) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(frame, "frame");

        frame.retain();
        final Frame previous;
        synchronized (lock) {
            previous = frames.put(name, frame);
        }

        if (previous == null) {
            log.debug("Registered frame '{}'", name);
            lifecycle(name, FrameLifecycleEvent.Kind.REGISTERED);
        } else if (previous == frame) {
            frame.release();
        } else {
            lifecycle(name, FrameLifecycleEvent.Kind.REPLACED);
            previous.release();
        }
    }

    public Optional<Frame> get(String name) {
        Objects.requireNonNull(name, "name");
        synchronized (lock) {
            return Optional.ofNullable(frames.get(name));
        }
    }

    /**
     * Looks up {@code name} and retains the frame before the bus lock is
     * dropped. The caller owns the returned reference.
     *
     * @return empty if the name is unknown or the frame has already been closed
     */
    public Optional<Frame> acquire(String name) {
        Objects.requireNonNull(name, "name");
        synchronized (lock) {
            Frame frame = frames.get(name);
            if (frame == null || frame.isClosed()) {
                return Optional.empty();
            }
            try {
                return Optional.of(frame.retain());
            } catch (IllegalStateException e) {
                log.debug("Frame '{}' closed while being acquired", name);
                return Optional.empty();
            }
        }
    }

    /**
     * @return whether a mapping existed
     */
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name");
        final Frame removed;
        synchronized (lock) {
            removed = frames.remove(name);
        }
        if (removed == null) {
            return false;
        }
        log.debug("Removed frame '{}'", name);
        lifecycle(name, FrameLifecycleEvent.Kind.REMOVED);
        removed.release();
        return true;
    }

    public void forEach(BiConsumer<String, Frame> action) {
        Objects.requireNonNull(action, "action");
        synchronized (lock) {
            frames.forEach(action);
        }
    }

    public Set<String> names() {
        synchronized (lock) {
            return Set.copyOf(frames.keySet());
        }
    }

    public int size() {
        synchronized (lock) {
            return frames.size();
        }
    }

    public boolean contains(String name) {
        synchronized (lock) {
            return frames.containsKey(name);
        }
    }

    /**
     * Removes every entry, releasing each frame reference.
     */
    public void clear() {
        final Map<String, Frame> drained;
        synchronized (lock) {
            drained = new LinkedHashMap<>(frames);
            frames.clear();
        }
        drained.forEach((name, frame) -> {
            lifecycle(name, FrameLifecycleEvent.Kind.REMOVED);
            frame.release();
        });
        if (!drained.isEmpty()) {
            log.debug("Cleared {} frame(s)", drained.size());
        }
    }

    private void lifecycle(String name, FrameLifecycleEvent.Kind kind) {
        sink.onFrameLifecycle(new FrameLifecycleEvent(Instant.now(), name, kind));
    }
}
