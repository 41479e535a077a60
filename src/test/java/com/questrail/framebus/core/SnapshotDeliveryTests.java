package com.questrail.framebus.core;

import com.questrail.framebus.api.CallbackPolicy;
import com.questrail.framebus.api.Frame;
import com.questrail.framebus.config.FrameBusConfig;
import com.questrail.framebus.config.OverflowPolicy;
import com.questrail.framebus.config.SnapshotQueuePolicy;
import com.questrail.framebus.layout.FrameLayout;
import com.questrail.framebus.observability.CallbackFailureEvent;
import com.questrail.framebus.observability.RecordingObservabilitySink;
import com.questrail.framebus.observability.SnapshotDroppedEvent;
import com.questrail.framebus.test.SensorFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Threaded subscribers: one worker per subscriber, FIFO delivery, bounded
 * queues and clean shutdown.
 */
class SnapshotDeliveryTests
{
    private static final long TIMEOUT_SECONDS = 5;

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<Frame> frames = new ArrayList<>();

    @AfterEach
    void tearDown() {
        frames.forEach(Frame::close);
    }

    private SensorFrame frame(SnapshotQueuePolicy policy) {
        FrameBusConfig config = FrameBusConfig.builder().withSnapshotQueuePolicy(policy).build();
        SensorFrame frame = new SensorFrame("Sensor1", config, sink);
        frames.add(frame);
        return frame;
    }

    /**
     * Subscriber whose first delivery parks until {@link #open()} is called.
     */
    private static final class GatedSubscriber
    {
        final CountDownLatch firstArrived = new CountDownLatch(1);
        final CountDownLatch gate = new CountDownLatch(1);
        final List<Integer> values = Collections.synchronizedList(new ArrayList<>());

        void onSnapshot(byte[] snapshot, int length) {
            values.add(SensorFrame.valueOf(snapshot));
            firstArrived.countDown();
            try {
                gate.await(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        void awaitFirst() throws InterruptedException {
            assertTrue(firstArrived.await(TIMEOUT_SECONDS, TimeUnit.SECONDS), "first snapshot not delivered");
        }

        void open() {
            gate.countDown();
        }
    }

    private static void awaitCondition(BooleanSupplier condition, String message)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message);
            }
            Thread.sleep(5);
        }
    }

    @Test
    void snapshotsArriveInPublishOrderOnAWorkerThread() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        int count = 200;
        List<Integer> values = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(count);

        frame.addSnapshotCallback((snapshot, length) -> {
            assertEquals(12, length);
            threadName.set(Thread.currentThread().getName());
            values.add(SensorFrame.valueOf(snapshot));
            done.countDown();
        });

        for (int i = 1; i <= count; i++) {
            frame.publishValue(i);
        }

        assertTrue(done.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        for (int i = 0; i < count; i++) {
            assertEquals(i + 1, values.get(i));
        }
        assertEquals("framebus-Sensor1-cb-1", threadName.get());
    }

    @Test
    void eachSnapshotIsTakenAtPublishTime() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        GatedSubscriber subscriber = new GatedSubscriber();
        frame.addSnapshotCallback(subscriber::onSnapshot);

        frame.publishValue(1);
        subscriber.awaitFirst();
        frame.publishValue(2);
        frame.setValue(99);
        subscriber.open();

        awaitCondition(() -> subscriber.values.size() == 2, "second snapshot not delivered");
        assertEquals(List.of(1, 2), subscriber.values);
    }

    @Test
    void everyThreadedSubscriberGetsItsOwnCopy() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        CountDownLatch done = new CountDownLatch(2);
        AtomicInteger secondSaw = new AtomicInteger();
        CountDownLatch firstMutated = new CountDownLatch(1);

        frame.addSnapshotCallback((snapshot, length) -> {
            snapshot[0] = (byte) 0x7F;
            firstMutated.countDown();
            done.countDown();
        });
        frame.addSnapshotCallback((snapshot, length) -> {
            try {
                firstMutated.await(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            secondSaw.set(SensorFrame.valueOf(snapshot));
            done.countDown();
        });

        frame.publishValue(5);

        assertTrue(done.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertEquals(5, secondSaw.get());
        assertEquals(5, frame.value());
    }

    @Test
    void directCallbacksRunBeforeNotifyReturnsWhileThreadedOnesRunElsewhere() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        Thread publisher = Thread.currentThread();
        AtomicReference<Thread> directThread = new AtomicReference<>();
        AtomicReference<Thread> threadedThread = new AtomicReference<>();
        CountDownLatch threadedDone = new CountDownLatch(1);

        frame.addCallback(f -> directThread.set(Thread.currentThread()), CallbackPolicy.DIRECT);
        frame.addSnapshotCallback((s, n) -> {
            threadedThread.set(Thread.currentThread());
            threadedDone.countDown();
        });

        frame.notifyCallbacks();
        assertSame(publisher, directThread.get());

        assertTrue(threadedDone.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertNotSame(publisher, threadedThread.get());
    }

    @Test
    void removeCallbackWaitsForTheInFlightCallbackAndDropsTheRest() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        GatedSubscriber subscriber = new GatedSubscriber();
        long id = frame.addSnapshotCallback(subscriber::onSnapshot);

        frame.publishValue(1);
        subscriber.awaitFirst();
        frame.publishValue(2);
        frame.publishValue(3);

        AtomicBoolean removed = new AtomicBoolean();
        Thread remover = new Thread(() -> removed.set(frame.removeCallback(id)));
        remover.start();

        awaitCondition(() -> remover.getState() == Thread.State.WAITING
                || remover.getState() == Thread.State.TIMED_WAITING, "remover did not block on join");
        assertTrue(remover.isAlive());

        subscriber.open();
        remover.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
        assertFalse(remover.isAlive());
        assertTrue(removed.get());

        frame.publishValue(4);
        Thread.sleep(50);
        assertEquals(List.of(1), subscriber.values);
        assertEquals(0, frame.callbackCount());
    }

    @Test
    void closeStopsAndJoinsEveryWorker() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        List<Thread> workers = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch seen = new CountDownLatch(3);
        for (int i = 0; i < 3; i++) {
            frame.addSnapshotCallback((s, n) -> {
                workers.add(Thread.currentThread());
                seen.countDown();
            });
        }
        frame.notifyCallbacks();
        assertTrue(seen.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));

        frame.retain();
        assertTrue(frame.release());

        assertTrue(frame.isClosed());
        assertEquals(0, frame.callbackCount());
        for (Thread worker : workers) {
            assertFalse(worker.isAlive(), worker.getName() + " still running");
        }
    }

    @Test
    void workerMayRemoveItsOwnSubscription() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        AtomicLong id = new AtomicLong();
        AtomicBoolean removed = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);

        id.set(frame.addSnapshotCallback((s, n) -> {
            removed.set(frame.removeCallback(id.get()));
            done.countDown();
        }));

        frame.notifyCallbacks();

        assertTrue(done.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertTrue(removed.get());
        assertEquals(0, frame.callbackCount());
    }

    @Test
    void failingThreadedCallbackIsReportedAndKeepsRunning() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        CountDownLatch second = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();

        frame.addSnapshotCallback((s, n) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first delivery fails");
            }
            second.countDown();
        });

        frame.publishValue(1);
        frame.publishValue(2);

        assertTrue(second.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        List<CallbackFailureEvent> failures = sink.eventsOfType(CallbackFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals(CallbackPolicy.THREADED, failures.get(0).policy());
    }

    // ---------- bounded queues ----------

    @Test
    void dropNewestDiscardsIncomingSnapshotsWhenFull() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.bounded(2, OverflowPolicy.DROP_NEWEST));
        GatedSubscriber subscriber = new GatedSubscriber();
        frame.addSnapshotCallback(subscriber::onSnapshot);

        frame.publishValue(1);
        subscriber.awaitFirst();
        frame.publishValue(2);
        frame.publishValue(3);
        frame.publishValue(4);
        subscriber.open();

        awaitCondition(() -> subscriber.values.size() == 3, "queued snapshots not delivered");
        Thread.sleep(50);
        assertEquals(List.of(1, 2, 3), subscriber.values);

        List<SnapshotDroppedEvent> drops = sink.eventsOfType(SnapshotDroppedEvent.class);
        assertEquals(1, drops.size());
        assertEquals(OverflowPolicy.DROP_NEWEST, drops.get(0).overflow());
    }

    @Test
    void dropOldestKeepsTheLatestSnapshots() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.bounded(2, OverflowPolicy.DROP_OLDEST));
        GatedSubscriber subscriber = new GatedSubscriber();
        frame.addSnapshotCallback(subscriber::onSnapshot);

        frame.publishValue(1);
        subscriber.awaitFirst();
        frame.publishValue(2);
        frame.publishValue(3);
        frame.publishValue(4);
        subscriber.open();

        awaitCondition(() -> subscriber.values.size() == 3, "queued snapshots not delivered");
        Thread.sleep(50);
        assertEquals(List.of(1, 3, 4), subscriber.values);
        assertEquals(1, sink.eventsOfType(SnapshotDroppedEvent.class).size());
    }

    @Test
    void blockPublisherWaitsForRoom() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.bounded(1, OverflowPolicy.BLOCK_PUBLISHER));
        GatedSubscriber subscriber = new GatedSubscriber();
        frame.addSnapshotCallback(subscriber::onSnapshot);

        frame.publishValue(1);
        subscriber.awaitFirst();
        frame.publishValue(2);

        Thread publisher = new Thread(() -> frame.publishValue(3));
        publisher.start();
        awaitCondition(() -> publisher.getState() == Thread.State.WAITING, "publisher did not block");

        subscriber.open();
        publisher.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
        assertFalse(publisher.isAlive());

        awaitCondition(() -> subscriber.values.size() == 3, "snapshots not delivered");
        assertEquals(List.of(1, 2, 3), subscriber.values);
        assertTrue(sink.eventsOfType(SnapshotDroppedEvent.class).isEmpty());
    }

    @Test
    void blockedPublisherDoesNotLockOutTheSubscriberCallback() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.bounded(1, OverflowPolicy.BLOCK_PUBLISHER));
        GatedSubscriber subscriber = new GatedSubscriber();
        List<Integer> counts = Collections.synchronizedList(new ArrayList<>());
        frame.addSnapshotCallback((snapshot, length) -> {
            subscriber.onSnapshot(snapshot, length);
            counts.add(frame.callbackCount());
        });

        frame.publishValue(1);
        subscriber.awaitFirst();
        frame.publishValue(2);

        Thread publisher = new Thread(() -> frame.publishValue(3));
        publisher.start();
        awaitCondition(() -> publisher.getState() == Thread.State.WAITING, "publisher did not block");

        subscriber.open();
        publisher.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
        assertFalse(publisher.isAlive(), "publisher still blocked");

        awaitCondition(() -> counts.size() == 3, "snapshots not delivered");
        assertEquals(List.of(1, 2, 3), subscriber.values);
        assertEquals(List.of(1, 1, 1), counts);
    }

    @Test
    void closeReleasesABlockedPublisher() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.bounded(1, OverflowPolicy.BLOCK_PUBLISHER));
        GatedSubscriber subscriber = new GatedSubscriber();
        frame.addSnapshotCallback(subscriber::onSnapshot);

        frame.publishValue(1);
        subscriber.awaitFirst();
        frame.publishValue(2);

        Thread publisher = new Thread(() -> frame.publishValue(3));
        publisher.start();
        awaitCondition(() -> publisher.getState() == Thread.State.WAITING, "publisher did not block");

        Thread closer = new Thread(frame::close);
        closer.start();
        awaitCondition(() -> !publisher.isAlive(), "publisher not released by close");

        subscriber.open();
        closer.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
        assertFalse(closer.isAlive(), "close did not complete");
        assertTrue(frame.isClosed());
        assertEquals(List.of(1), subscriber.values);
    }

    @Test
    void unboundedQueueNeverDrops() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.unbounded());
        GatedSubscriber subscriber = new GatedSubscriber();
        frame.addSnapshotCallback(subscriber::onSnapshot);

        frame.publishValue(0);
        subscriber.awaitFirst();
        for (int i = 1; i <= 2000; i++) {
            frame.publishValue(i);
        }
        subscriber.open();

        awaitCondition(() -> subscriber.values.size() == 2001, "not every snapshot delivered");
        assertTrue(sink.eventsOfType(SnapshotDroppedEvent.class).isEmpty());
    }

    // ---------- mutual exclusion ----------

    @Test
    void readersNeverObserveAHalfWrittenPayload() throws Exception {
        FrameLayout layout = FrameLayout.builder().int64("a").int64("b").build();
        AbstractFrame frame = new AbstractFrame("Pair", layout, FrameBusConfig.defaults(), sink) {
            @Override
            public String typeName() {
                return "Pair";
            }
        };
        frames.add(frame);

        int writers = 4;
        int readers = 4;
        int iterations = 2000;
        AtomicInteger torn = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();

        for (int w = 0; w < writers; w++) {
            long base = (long) w * iterations;
            threads.add(new Thread(() -> {
                awaitQuietly(start);
                for (int i = 0; i < iterations; i++) {
                    long v = base + i;
                    frame.writeRaw(buffer -> {
                        buffer.putLong(0, v);
                        Thread.yield();
                        buffer.putLong(8, v);
                    });
                }
            }));
        }
        for (int r = 0; r < readers; r++) {
            threads.add(new Thread(() -> {
                awaitQuietly(start);
                for (int i = 0; i < iterations; i++) {
                    frame.readRaw(buffer -> {
                        if (buffer.getLong(0) != buffer.getLong(8)) {
                            torn.incrementAndGet();
                        }
                    });
                }
            }));
        }

        threads.forEach(Thread::start);
        start.countDown();
        for (Thread t : threads) {
            t.join(TimeUnit.SECONDS.toMillis(30));
            assertFalse(t.isAlive());
        }

        assertEquals(0, torn.get());
    }

    @Test
    void concurrentIncrementsAreNeverLost() throws Exception {
        SensorFrame frame = frame(SnapshotQueuePolicy.defaults());
        int threadCount = 8;
        int increments = 5000;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();

        for (int t = 0; t < threadCount; t++) {
            threads.add(new Thread(() -> {
                awaitQuietly(start);
                for (int i = 0; i < increments; i++) {
                    frame.writeRaw(buffer -> buffer.putInt(0, buffer.getInt(0) + 1));
                }
            }));
        }

        threads.forEach(Thread::start);
        start.countDown();
        for (Thread t : threads) {
            t.join(TimeUnit.SECONDS.toMillis(30));
            assertFalse(t.isAlive());
        }

        assertEquals(threadCount * increments, frame.value());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
