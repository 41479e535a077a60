package com.questrail.framebus.core;

import com.questrail.framebus.api.CallbackPolicy;
import com.questrail.framebus.api.Frame;
import com.questrail.framebus.api.FrameCallback;
import com.questrail.framebus.api.SnapshotCallback;
import com.questrail.framebus.config.FrameBusConfig;
import com.questrail.framebus.observability.CallbackFailureEvent;
import com.questrail.framebus.observability.FrameBusObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Ordered subscriber table of one frame.
 *
 * <p>Entries keep registration order. Identifiers start at 1 and are never
 * reused within the owning frame. Threaded workers are stopped and joined
 * after the table lock has been released.</p>
 */
final class CallbackTable
{
    private sealed interface Entry permits DirectEntry, ThreadedEntry {
        long id();
    }

    private record DirectEntry(long id, FrameCallback callback) implements Entry {}

    private record ThreadedEntry(long id, SnapshotWorker worker) implements Entry {}

    private final String frameId;
    private final FrameBusConfig config;
    private final FrameBusObservabilitySink sink;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Entry> entries = new ArrayList<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private boolean closed;

    CallbackTable(String frameId, FrameBusConfig config, FrameBusObservabilitySink sink) {
        this.frameId = Objects.requireNonNull(frameId, "frameId");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    long addDirect(FrameCallback callback) {
        Objects.requireNonNull(callback, "callback");
        lock.lock();
        try {
            ensureOpen();
            long id = nextId.getAndIncrement();
            entries.add(new DirectEntry(id, callback));
            return id;
        } finally {
            lock.unlock();
        }
    }

    long addThreaded(SnapshotCallback callback) {
        Objects.requireNonNull(callback, "callback");
        lock.lock();
        try {
            ensureOpen();
            long id = nextId.getAndIncrement();
            SnapshotWorker worker = new SnapshotWorker(
                    frameId,
                    id,
                    callback,
                    config.snapshotQueuePolicy(),
                    sink,
                    config.workerNamePrefix() + "-" + frameId + "-cb-" + id,
                    config.daemonWorkers());
            worker.start();
            entries.add(new ThreadedEntry(id, worker));
            return id;
        } finally {
            lock.unlock();
        }
    }

    boolean remove(long id) {
        Entry removed = null;
        lock.lock();
        try {
            for (int i = 0; i < entries.size(); i++) {
                if (entries.get(i).id() == id) {
                    removed = entries.remove(i);
                    break;
                }
            }
        } finally {
            lock.unlock();
        }

        if (removed instanceof ThreadedEntry threaded) {
            threaded.worker().stopAndJoin();
        }
        return removed != null;
    }

    /**
     * Runs direct entries in registration order and queues one private
     * snapshot copy for every threaded entry.
     *
     * <p>A threaded entry whose full queue makes the publisher wait is served
     * after the table lock has been released, so its callback can still use
     * this table. Only such waiting entries can see snapshots of concurrent
     * publishers out of order.</p>
     *
     * @param frame       the frame handed to direct callbacks
     * @param snapshotter produces the serialized payload; called at most once
     */
    void publish(Frame frame, Supplier<byte[]> snapshotter) {
        List<Map.Entry<SnapshotWorker, byte[]>> deferred = List.of();

        lock.lock();
        try {
            if (entries.isEmpty()) {
                return;
            }
            // Iterate a copy: a direct callback may add or remove entries.
            List<Entry> current = List.copyOf(entries);
            byte[] snapshot = null;

            for (Entry entry : current) {
                if (entry instanceof DirectEntry direct) {
                    try {
                        direct.callback().onPublish(frame);
                    } catch (RuntimeException e) {
                        sink.onCallbackFailure(new CallbackFailureEvent(
                                Instant.now(), frameId, direct.id(), CallbackPolicy.DIRECT, e));
                    }
                } else if (entry instanceof ThreadedEntry threaded) {
                    if (snapshot == null) {
                        snapshot = snapshotter.get();
                    }
                    byte[] copy = snapshot.clone();
                    if (!threaded.worker().offer(copy)) {
                        if (deferred.isEmpty()) {
                            deferred = new ArrayList<>();
                        }
                        deferred.add(Map.entry(threaded.worker(), copy));
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        for (Map.Entry<SnapshotWorker, byte[]> pending : deferred) {
            pending.getKey().enqueue(pending.getValue());
        }
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empties the table and rejects further registrations.
     */
    void closeAll() {
        List<Entry> drained;
        lock.lock();
        try {
            closed = true;
            drained = new ArrayList<>(entries);
            entries.clear();
        } finally {
            lock.unlock();
        }

        for (Entry entry : drained) {
            if (entry instanceof ThreadedEntry threaded) {
                threaded.worker().stopAndJoin();
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("frame '" + frameId + "' is closed");
        }
    }
}
