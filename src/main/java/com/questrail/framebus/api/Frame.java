package com.questrail.framebus.api;

import com.questrail.framebus.error.InvalidPolicyException;
import com.questrail.framebus.error.SignalTypeMismatchException;
import com.questrail.framebus.error.SizeMismatchException;
import com.questrail.framebus.error.UnknownSignalException;
import com.questrail.framebus.layout.FrameCodec;
import com.questrail.framebus.layout.FrameLayout;

import java.util.Set;

/**
 * Frame
 * -----------------------------------------------------------------------------
 * A named, fixed-layout binary payload together with its signal table and its
 * subscriber list.
 *
 * <h2>Storage</h2>
 * A frame exclusively owns one payload of {@link #size()} bytes described by
 * its {@link FrameLayout}. All access to the bytes is scoped: callers receive a
 * view for the duration of {@link #readRaw(RawReader)} or
 * {@link #writeRaw(RawWriter)} and never hold a reference afterwards.
 *
 * <h2>Lock domains</h2>
 * <ul>
 *   <li>The payload is guarded by a reader/writer lock: concurrent reads are
 *       allowed, any write excludes everything else</li>
 *   <li>The callback table is guarded by a single lock covering add, remove,
 *       iteration and the hand-off of snapshots to threaded subscribers</li>
 * </ul>
 * Closures passed to raw access run while the payload lock is held and must
 * not re-enter the same frame.
 *
 * <h2>Publishing</h2>
 * Writes never notify on their own. {@link #notifyCallbacks()} (or the
 * {@code ...WithPublish} variants) runs {@link CallbackPolicy#DIRECT}
 * subscribers synchronously in registration order and enqueues one payload
 * snapshot per {@link CallbackPolicy#THREADED} subscriber.
 *
 * <h2>Sharing</h2>
 * Frames are shared by reference counting. The frame bus and each port
 * connection or subscription hold one reference. When the last reference is
 * released the frame closes: every delivery thread is stopped and joined
 * before {@link #release()} returns.
 */
public interface Frame extends MethodTable, AutoCloseable
{
    /**
     * The instance name this frame was created with.
     */
    String id();

    /**
     * The static name of the concrete frame type.
     */
    String typeName();

    /**
     * Static payload size in bytes.
     */
    int size();

    FrameLayout layout();

    /**
     * Names of all signals, in layout order.
     */
    Set<String> signalNames();

    // -------------------------------------------------------------------------
    // Raw access
    // -------------------------------------------------------------------------

    void readRaw(RawReader reader);

    void writeRaw(RawWriter writer);

    // -------------------------------------------------------------------------
    // Signals
    // -------------------------------------------------------------------------

    /**
     * @throws UnknownSignalException if no signal named {@code name} exists
     */
    SignalValue getSignal(String name);

    /**
     * Writes a signal without notifying subscribers.
     *
     * @throws UnknownSignalException       if no signal named {@code name} exists
     * @throws SignalTypeMismatchException  if {@code value}'s kind differs from
     *                                      the field's kind
     */
    void setSignal(String name, SignalValue value);

    /**
     * {@link #setSignal(String, SignalValue)} followed by
     * {@link #notifyCallbacks()}.
     */
    void setSignalWithPublish(String name, SignalValue value);

    // -------------------------------------------------------------------------
    // Serialization
    // -------------------------------------------------------------------------

    /**
     * Applies the installed codec to the payload under the read lock.
     */
    byte[] serialize();

    /**
     * Applies the installed codec to {@code bytes} under the write lock.
     *
     * @throws SizeMismatchException with the default codec, when
     *                               {@code bytes.length != size()}
     */
    void deserialize(byte[] bytes);

    /**
     * Deserializes, then notifies subscribers.
     *
     * @return {@code true} if {@code bytes.length} matched {@link #size()}.
     *         A custom codec may accept other lengths: the input is then
     *         applied and published and {@code false} is returned as
     *         information. With the default codec a wrong length is rejected
     *         and nothing is published.
     */
    boolean deserializeWithPublish(byte[] bytes);

    /**
     * Replaces the serializer/deserializer pair.
     */
    void installCodec(FrameCodec codec);

    // -------------------------------------------------------------------------
    // Callbacks
    // -------------------------------------------------------------------------

    /**
     * Registers a synchronous callback.
     *
     * @throws InvalidPolicyException if {@code policy} is
     *                                {@link CallbackPolicy#THREADED}; use
     *                                {@link #addSnapshotCallback(SnapshotCallback)}
     */
    long addCallback(FrameCallback callback, CallbackPolicy policy);

    /**
     * Registers a synchronous callback.
     */
    default long addCallback(FrameCallback callback) {
        return addCallback(callback, CallbackPolicy.DIRECT);
    }

    /**
     * Registers an asynchronous subscriber served by its own worker thread.
     *
     * @return the callback id
     */
    long addSnapshotCallback(SnapshotCallback callback);

    /**
     * Removes a callback. For a threaded subscriber this stops and joins its
     * worker, blocking until an in-flight callback returns. Snapshots still
     * queued are dropped.
     *
     * @return {@code true} if a callback with this id existed
     */
    boolean removeCallback(long callbackId);

    void notifyCallbacks();

    int callbackCount();

    // -------------------------------------------------------------------------
    // Sharing and lifecycle
    // -------------------------------------------------------------------------

    /**
     * Adds one holder.
     *
     * @throws IllegalStateException if the frame is already closed
     */
    Frame retain();

    /**
     * Removes one holder and closes the frame when none remain.
     *
     * @return {@code true} if this call closed the frame
     */
    boolean release();

    int refCount();

    /**
     * Stops and joins every threaded subscriber and removes all callbacks.
     * Idempotent.
     */
    @Override
    void close();

    boolean isClosed();
}
