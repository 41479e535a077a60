package com.questrail.framebus.core;

import com.questrail.framebus.api.CallbackPolicy;
import com.questrail.framebus.api.Frame;
import com.questrail.framebus.api.FrameDataListener;
import com.questrail.framebus.api.MethodFunction;
import com.questrail.framebus.api.Port;
import com.questrail.framebus.api.RawReader;
import com.questrail.framebus.api.SignalValue;
import com.questrail.framebus.error.FrameBusException;
import com.questrail.framebus.error.FrameNotFoundException;
import com.questrail.framebus.error.SizeMismatchException;
import com.questrail.framebus.registry.FrameBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * AbstractPort
 * -----------------------------------------------------------------------------
 * Base implementation of {@link Port}: the frame binding layer shared by every
 * transport.
 *
 * <h2>Connections</h2>
 * {@link #connectFrame(String)} resolves a frame on the {@link FrameBus} and
 * keeps a local reference to it. Disconnecting drops that reference only;
 * the bus entry is untouched.
 *
 * <h2>Failures</h2>
 * Forwarding operations report failure as {@code false} (or {@code 0} for
 * subscriptions) and log at DEBUG. Only
 * {@link #getSignalFromFrameAsAny(String, String)} throws, because it has no
 * other way to say "no value".
 *
 * <h2>Subscriptions</h2>
 * Subscription ids are issued by the port, starting at 1, and map to the
 * frame and frame-local callback id they wrap. Each subscription holds its own
 * frame reference, so disconnecting a frame does not cancel its
 * subscriptions.
 *
 * <h2>What subclasses provide</h2>
 * {@link #open()}, {@link #close()}, {@link #type()} and {@link #typeName()}.
 * A transport usually calls {@link #release()} from {@link #close()}.
 */
public abstract class AbstractPort implements Port
{
    private static final Logger log = LoggerFactory.getLogger(AbstractPort.class);

    private record Subscription(Frame frame, long callbackId) {}

    private final String instanceName;
    private final FrameBus frameBus;

    private final Object lock = new Object();
    private final Map<String, Frame> connections = new HashMap<>();
    private final Map<Long, Subscription> subscriptions = new HashMap<>();
    private final AtomicLong nextSubscriptionId = new AtomicLong(1);

    private final DefaultMethodTable methods;

    protected AbstractPort(String instanceName, FrameBus frameBus) {
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
        this.frameBus = Objects.requireNonNull(frameBus, "frameBus");
        if (instanceName.isBlank()) {
            throw new IllegalArgumentException("Port instance name must not be blank");
        }
        this.methods = new DefaultMethodTable("port '" + instanceName + "'");
        registerBuiltInMethods();
    }

    @Override
    public final String name() {
        return instanceName;
    }

    protected final FrameBus frameBus() {
        return frameBus;
    }

    // -------------------------------------------------------------------------
    // Connections
    // -------------------------------------------------------------------------

    @Override
    public final boolean connectFrame(String frameName) {
        Objects.requireNonNull(frameName, "frameName");
        synchronized (lock) {
            if (connections.containsKey(frameName)) {
                return true;
            }
            Optional<Frame> frame = frameBus.acquire(frameName);
            if (frame.isEmpty()) {
                log.debug("Port '{}': frame '{}' not on the bus", instanceName, frameName);
                return false;
            }
            connections.put(frameName, frame.get());
        }
        log.debug("Port '{}' connected to frame '{}'", instanceName, frameName);
        return true;
    }

    @Override
    public final void disconnectFrame(String frameName) {
        Objects.requireNonNull(frameName, "frameName");
        final Frame removed;
        synchronized (lock) {
            removed = connections.remove(frameName);
        }
        if (removed != null) {
            log.debug("Port '{}' disconnected from frame '{}'", instanceName, frameName);
            removed.release();
        }
    }

    @Override
    public final boolean isConnected(String frameName) {
        synchronized (lock) {
            return connections.containsKey(frameName);
        }
    }

    @Override
    public final Set<String> connectedFrames() {
        synchronized (lock) {
            return Set.copyOf(connections.keySet());
        }
    }

    /**
     * Resolves a connected frame.
     */
    protected final Optional<Frame> connectedFrame(String frameName) {
        Objects.requireNonNull(frameName, "frameName");
        synchronized (lock) {
            return Optional.ofNullable(connections.get(frameName));
        }
    }

    // -------------------------------------------------------------------------
    // Signal and raw access
    // -------------------------------------------------------------------------

    @Override
    public final boolean setSignalToFrame(String frameName, String signal, SignalValue value) {
        return forward(frameName, frame -> frame.setSignal(signal, value));
    }

    @Override
    public final boolean setSignalToFrameWithPublish(String frameName, String signal, SignalValue value) {
        return forward(frameName, frame -> frame.setSignalWithPublish(signal, value));
    }

    @Override
    public final boolean setRawDataToFrame(String frameName, byte[] data) {
        Objects.requireNonNull(data, "data");
        return forward(frameName, frame -> copyInto(frame, data));
    }

    @Override
    public final boolean setRawDataToFrameWithPublish(String frameName, byte[] data) {
        Objects.requireNonNull(data, "data");
        return forward(frameName, frame -> {
            copyInto(frame, data);
            frame.notifyCallbacks();
        });
    }

    @Override
    public final SignalValue getSignalFromFrameAsAny(String frameName, String signal) {
        Frame frame = connectedFrame(frameName).orElseThrow(() -> new FrameNotFoundException(frameName));
        return frame.getSignal(signal);
    }

    @Override
    public final boolean getRawDataFromFrame(String frameName, RawReader reader) {
        Objects.requireNonNull(reader, "reader");
        return forward(frameName, frame -> frame.readRaw(reader));
    }

    /**
     * Copies {@code data} over the whole payload.
     *
     * @throws SizeMismatchException if the length differs from the frame size;
     *         nothing is written then
     */
    private static void copyInto(Frame frame, byte[] data) {
        if (data.length != frame.size()) {
            throw new SizeMismatchException(
                    "frame '" + frame.id() + "'", frame.size(), data.length);
        }
        frame.writeRaw(buffer -> buffer.put(0, data));
    }

    @FunctionalInterface
    private interface FrameAction {
        void apply(Frame frame);
    }

    private boolean forward(String frameName, FrameAction action) {
        Optional<Frame> frame = connectedFrame(frameName);
        if (frame.isEmpty()) {
            log.debug("Port '{}': frame '{}' not connected", instanceName, frameName);
            return false;
        }
        try {
            action.apply(frame.get());
            return true;
        } catch (FrameBusException e) {
            log.debug("Port '{}': operation on frame '{}' failed ({}): {}",
                    instanceName, frameName, e.kind(), e.getMessage());
            return false;
        }
    }

    // -------------------------------------------------------------------------
    // Subscriptions
    // -------------------------------------------------------------------------

    @Override
    public final long subscribeFrame(String frameName, FrameDataListener listener) {
        Objects.requireNonNull(listener, "listener");
        return subscribe(frameName, frame -> frame.addSnapshotCallback(listener::onFrameData));
    }

    @Override
    public final long subscribeFrameDirect(String frameName, FrameDataListener listener) {
        Objects.requireNonNull(listener, "listener");
        return subscribe(frameName, frame -> frame.addCallback(published -> published.readRaw(buffer -> {
            byte[] copy = copyOf(buffer);
            listener.onFrameData(copy, copy.length);
        }), CallbackPolicy.DIRECT));
    }

    private static byte[] copyOf(ByteBuffer buffer) {
        byte[] copy = new byte[buffer.remaining()];
        buffer.get(0, copy);
        return copy;
    }

    @FunctionalInterface
    private interface Registration {
        long register(Frame frame);
    }

    private long subscribe(String frameName, Registration registration) {
        final Frame frame;
        synchronized (lock) {
            Frame connected = connections.get(frameName);
            if (connected == null) {
                log.debug("Port '{}': cannot subscribe, frame '{}' not connected", instanceName, frameName);
                return 0;
            }
            if (connected.isClosed()) {
                log.debug("Port '{}': cannot subscribe, frame '{}' is closed", instanceName, frameName);
                return 0;
            }
            try {
                frame = connected.retain();
            } catch (IllegalStateException e) {
                log.debug("Port '{}': cannot subscribe, frame '{}' is closed", instanceName, frameName);
                return 0;
            }
        }

        final long callbackId;
        try {
            callbackId = registration.register(frame);
        } catch (RuntimeException e) {
            frame.release();
            if (frame.isClosed()) {
                log.debug("Port '{}': frame '{}' closed during subscribe", instanceName, frameName);
                return 0;
            }
            throw e;
        }

        long subscriptionId = nextSubscriptionId.getAndIncrement();
        synchronized (lock) {
            subscriptions.put(subscriptionId, new Subscription(frame, callbackId));
        }
        log.debug("Port '{}' subscribed to frame '{}' (subscription {}, callback {})",
                instanceName, frameName, subscriptionId, callbackId);
        return subscriptionId;
    }

    @Override
    public final boolean unsubscribeFrame(long subscriptionId) {
        final Subscription subscription;
        synchronized (lock) {
            subscription = subscriptions.remove(subscriptionId);
        }
        if (subscription == null) {
            return false;
        }
        subscription.frame().removeCallback(subscription.callbackId());
        subscription.frame().release();
        return true;
    }

    @Override
    public final void release() {
        final List<Long> subscriptionIds;
        final List<String> frameNames;
        synchronized (lock) {
            subscriptionIds = new ArrayList<>(subscriptions.keySet());
            frameNames = new ArrayList<>(connections.keySet());
        }
        subscriptionIds.forEach(this::unsubscribeFrame);
        frameNames.forEach(this::disconnectFrame);
    }

    // -------------------------------------------------------------------------
    // Method table
    // -------------------------------------------------------------------------

    @Override
    public final void registerMethod(String name, MethodFunction fn) {
        methods.registerMethod(name, fn);
    }

    @Override
    public final SignalValue invoke(String name, List<SignalValue> args) {
        return methods.invoke(name, args);
    }

    @Override
    public final List<String> listMethods() {
        return methods.listMethods();
    }

    private void registerBuiltInMethods() {
        methods.registerMethod("name", args -> SignalValue.of(name()));
        methods.registerMethod("type", args -> SignalValue.of(type()));
        methods.registerMethod("open", args -> SignalValue.of(open()));
        methods.registerMethod("close", args -> {
            close();
            return SignalValue.none();
        });
        methods.registerMethod("connectFrame",
                args -> SignalValue.of(connectFrame(MethodArguments.text(args, 0, "connectFrame"))));
        methods.registerMethod("disconnectFrame", args -> {
            disconnectFrame(MethodArguments.text(args, 0, "disconnectFrame"));
            return SignalValue.none();
        });
        methods.registerMethod("setSignalToFrame", args -> SignalValue.of(setSignalToFrame(
                MethodArguments.text(args, 0, "setSignalToFrame"),
                MethodArguments.text(args, 1, "setSignalToFrame"),
                MethodArguments.at(args, 2, "setSignalToFrame"))));
        methods.registerMethod("setSignalToFrameWithPublish", args -> SignalValue.of(setSignalToFrameWithPublish(
                MethodArguments.text(args, 0, "setSignalToFrameWithPublish"),
                MethodArguments.text(args, 1, "setSignalToFrameWithPublish"),
                MethodArguments.at(args, 2, "setSignalToFrameWithPublish"))));
        methods.registerMethod("getSignalFromFrame", args -> getSignalFromFrameAsAny(
                MethodArguments.text(args, 0, "getSignalFromFrame"),
                MethodArguments.text(args, 1, "getSignalFromFrame")));
        methods.registerMethod("setRawDataToFrame", args -> SignalValue.of(setRawDataToFrame(
                MethodArguments.text(args, 0, "setRawDataToFrame"),
                MethodArguments.bytes(args, 1, "setRawDataToFrame"))));
        methods.registerMethod("setRawDataToFrameWithPublish", args -> SignalValue.of(setRawDataToFrameWithPublish(
                MethodArguments.text(args, 0, "setRawDataToFrameWithPublish"),
                MethodArguments.bytes(args, 1, "setRawDataToFrameWithPublish"))));
        methods.registerMethod("getRawDataFromFrame", args -> {
            String frameName = MethodArguments.text(args, 0, "getRawDataFromFrame");
            Frame frame = connectedFrame(frameName).orElseThrow(() -> new FrameNotFoundException(frameName));
            AtomicReference<byte[]> copy = new AtomicReference<>();
            frame.readRaw(buffer -> copy.set(copyOf(buffer)));
            return SignalValue.of(copy.get());
        });
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + instanceName + ", " + type() + "]";
    }
}
