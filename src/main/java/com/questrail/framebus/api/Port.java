package com.questrail.framebus.api;

import com.questrail.framebus.error.FrameNotFoundException;
import com.questrail.framebus.error.SignalTypeMismatchException;

import java.util.Set;

/**
 * Port
 * -----------------------------------------------------------------------------
 * Binding between an external communication endpoint (CAN, serial, UDP, ...)
 * and one or more frames held by the frame bus.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Transport lifecycle: {@link #open()} / {@link #close()}, implemented
 *       by concrete transports</li>
 *   <li>Frame connections: named frames resolved from the bus and cached
 *       locally; a port shares frames, it never owns them</li>
 *   <li>Forwarding of signal, raw and subscription calls to connected
 *       frames</li>
 * </ul>
 *
 * <h2>Failure reporting</h2>
 * Write and read helpers return {@code false} for every failure: frame not
 * connected, unknown signal, wrong value kind, wrong raw size. Transport loops
 * can treat all of these uniformly. Only
 * {@link #getSignalFromFrameAsAny(String, String)} throws, because it has a
 * value to return.
 */
public interface Port extends MethodTable
{
    /**
     * Instance name.
     */
    String name();

    /**
     * Static name of the concrete port type.
     */
    String typeName();

    /**
     * Transport tag, e.g. {@code "can"}, {@code "serial"}, {@code "udp"}.
     */
    String type();

    boolean open();

    void close();

    // -------------------------------------------------------------------------
    // Connections
    // -------------------------------------------------------------------------

    /**
     * Resolves {@code frameName} through the frame bus and caches it.
     * Repeating the call for a connected frame is a no-op.
     *
     * @return {@code false} if the bus has no frame with that name
     */
    boolean connectFrame(String frameName);

    /**
     * Drops the local connection. The frame stays registered in the bus.
     */
    void disconnectFrame(String frameName);

    boolean isConnected(String frameName);

    Set<String> connectedFrames();

    // -------------------------------------------------------------------------
    // Signal and raw access
    // -------------------------------------------------------------------------

    boolean setSignalToFrame(String frameName, String signal, SignalValue value);

    boolean setSignalToFrameWithPublish(String frameName, String signal, SignalValue value);

    /**
     * Copies {@code data} into the frame's payload.
     *
     * @return {@code false} without writing anything unless
     *         {@code data.length} equals the frame's size
     */
    boolean setRawDataToFrame(String frameName, byte[] data);

    boolean setRawDataToFrameWithPublish(String frameName, byte[] data);

    /**
     * @throws FrameNotFoundException if the frame is not connected to this port
     */
    SignalValue getSignalFromFrameAsAny(String frameName, String signal);

    /**
     * Typed variant of {@link #getSignalFromFrameAsAny(String, String)}.
     *
     * @param type the boxed Java type of the field, e.g. {@code Integer.class}
     *             for an {@code INT32} signal
     * @throws SignalTypeMismatchException if the value is not of {@code type}
     */
    default <T> T getSignalFromFrame(String frameName, String signal, Class<T> type) {
        SignalValue value = getSignalFromFrameAsAny(frameName, signal);
        Object boxed = value.boxed();
        if (!type.isInstance(boxed)) {
            throw new SignalTypeMismatchException(frameName + "." + signal, type, value.type());
        }
        return type.cast(boxed);
    }

    boolean getRawDataFromFrame(String frameName, RawReader reader);

    // -------------------------------------------------------------------------
    // Subscriptions
    // -------------------------------------------------------------------------

    /**
     * Subscribes asynchronously (threaded policy).
     *
     * @return a port-scoped subscription id, or {@code 0} if the frame is not
     *         connected
     */
    long subscribeFrame(String frameName, FrameDataListener listener);

    /**
     * Subscribes synchronously (direct policy).
     *
     * @return a port-scoped subscription id, or {@code 0} if the frame is not
     *         connected
     */
    long subscribeFrameDirect(String frameName, FrameDataListener listener);

    /**
     * @return {@code true} if the subscription existed
     */
    boolean unsubscribeFrame(long subscriptionId);

    /**
     * Drops every subscription, then every connection, releasing the frame
     * references they hold.
     */
    void release();
}
