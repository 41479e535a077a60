package com.questrail.framebus.core;

import com.questrail.framebus.api.CallbackPolicy;
import com.questrail.framebus.api.SnapshotCallback;
import com.questrail.framebus.config.SnapshotQueuePolicy;
import com.questrail.framebus.observability.CallbackFailureEvent;
import com.questrail.framebus.observability.FrameBusObservabilitySink;
import com.questrail.framebus.observability.SnapshotDroppedEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SnapshotWorker
 * =============================================================================
 * Dedicated delivery thread of one threaded subscriber.
 *
 * <h2>Lifecycle</h2>
 * The worker owns its thread from {@link #start()} until
 * {@link #stopAndJoin()} returns. While running it waits on a condition until
 * either a snapshot is queued or a stop is requested, then invokes the
 * callback outside every lock.
 *
 * <h2>Ordering</h2>
 * One FIFO queue per subscriber: snapshots are delivered in the order they
 * were enqueued.
 *
 * <h2>Stopping</h2>
 * A stop request discards undelivered snapshots and lets an in-flight
 * callback finish. Nothing is delivered once {@link #stopAndJoin()} has
 * returned. A callback that removes its own subscription stops the worker
 * without joining itself.
 *
 * <h2>Bounding</h2>
 * The queue follows a {@link SnapshotQueuePolicy}. Every discarded snapshot is
 * reported to the observability sink.
 */
final class SnapshotWorker
{
    private final String frameId;
    private final long callbackId;
    private final SnapshotCallback callback;
    private final SnapshotQueuePolicy queuePolicy;
    private final FrameBusObservabilitySink sink;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Condition space = lock.newCondition();
    private final Deque<byte[]> queue = new ArrayDeque<>();
    private boolean stopped;

    private final Thread thread;

    SnapshotWorker(String frameId,
                   long callbackId,
                   SnapshotCallback callback,
                   SnapshotQueuePolicy queuePolicy,
                   FrameBusObservabilitySink sink,
                   String threadName,
                   boolean daemon) {
        this.frameId = Objects.requireNonNull(frameId, "frameId");
        this.callbackId = callbackId;
        this.callback = Objects.requireNonNull(callback, "callback");
        this.queuePolicy = Objects.requireNonNull(queuePolicy, "queuePolicy");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.thread = new Thread(this::run, threadName);
        this.thread.setDaemon(daemon);
    }

    void start() {
        thread.start();
    }

    /**
     * Hands one snapshot to this subscriber. The array must not be shared with
     * any other subscriber. Under {@code BLOCK_PUBLISHER} this may wait for a
     * free slot, so the caller must not hold a lock the callback could need.
     */
    void enqueue(byte[] snapshot) {
        enqueue(snapshot, true);
    }

    /**
     * Like {@link #enqueue(byte[])} but never waits.
     *
     * @return {@code false} if the queue is full under {@code BLOCK_PUBLISHER}
     *         and the snapshot was neither queued nor dropped
     */
    boolean offer(byte[] snapshot) {
        return enqueue(snapshot, false);
    }

    private boolean enqueue(byte[] snapshot, boolean mayBlock) {
        boolean accept = true;
        boolean dropped = false;

        lock.lock();
        try {
            if (stopped) {
                return true;
            }
            if (queue.size() >= queuePolicy.capacity()) {
                switch (queuePolicy.overflow()) {
                    case DROP_OLDEST -> {
                        queue.pollFirst();
                        dropped = true;
                    }
                    case DROP_NEWEST -> {
                        accept = false;
                        dropped = true;
                    }
                    case BLOCK_PUBLISHER -> {
                        if (!mayBlock) {
                            return false;
                        }
                        accept = awaitSpace();
                        dropped = !accept && !stopped;
                    }
                }
            }
            if (accept) {
                queue.addLast(snapshot);
                available.signal();
            }
        } finally {
            lock.unlock();
        }

        if (dropped) {
            sink.onSnapshotDropped(new SnapshotDroppedEvent(
                    Instant.now(), frameId, callbackId, queuePolicy.overflow(), queuePolicy.capacity()));
        }
        return true;
    }

    /**
     * Waits for a free slot. Must be called holding {@link #lock}.
     *
     * @return {@code false} if the snapshot has to be dropped instead
     */
    private boolean awaitSpace() {
        // The worker's own callback publishing to this frame would wait for itself.
        if (Thread.currentThread() == thread) {
            return false;
        }
        while (!stopped && queue.size() >= queuePolicy.capacity()) {
            try {
                space.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return !stopped;
    }

    /**
     * Stops the worker, discards queued snapshots and waits for the thread to
     * finish its in-flight callback.
     */
    void stopAndJoin() {
        lock.lock();
        try {
            stopped = true;
            queue.clear();
            available.signalAll();
            space.signalAll();
        } finally {
            lock.unlock();
        }

        if (Thread.currentThread() == thread) {
            return;
        }

        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    int pending() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private void run() {
        while (true) {
            final byte[] snapshot;

            lock.lock();
            try {
                while (!stopped && queue.isEmpty()) {
                    available.awaitUninterruptibly();
                }
                if (stopped) {
                    return;
                }
                snapshot = queue.pollFirst();
                space.signal();
            } finally {
                lock.unlock();
            }

            try {
                callback.onSnapshot(snapshot, snapshot.length);
            } catch (RuntimeException e) {
                sink.onCallbackFailure(new CallbackFailureEvent(
                        Instant.now(), frameId, callbackId, CallbackPolicy.THREADED, e));
            }
        }
    }
}
