package com.questrail.framebus.core;

import com.questrail.framebus.api.CallbackPolicy;
import com.questrail.framebus.api.Frame;
import com.questrail.framebus.api.FrameCallback;
import com.questrail.framebus.api.MethodFunction;
import com.questrail.framebus.api.RawReader;
import com.questrail.framebus.api.RawWriter;
import com.questrail.framebus.api.SignalValue;
import com.questrail.framebus.api.SnapshotCallback;
import com.questrail.framebus.config.FrameBusConfig;
import com.questrail.framebus.error.InvalidPolicyException;
import com.questrail.framebus.error.SizeMismatchException;
import com.questrail.framebus.error.UnknownSignalException;
import com.questrail.framebus.layout.FrameCodec;
import com.questrail.framebus.layout.FrameLayout;
import com.questrail.framebus.layout.RawFrameCodec;
import com.questrail.framebus.layout.SignalField;
import com.questrail.framebus.observability.FrameBusObservabilitySink;
import com.questrail.framebus.observability.FrameLifecycleEvent;
import com.questrail.framebus.observability.Slf4jFrameBusObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * AbstractFrame
 * -----------------------------------------------------------------------------
 * Base implementation of {@link Frame}: a fixed-size payload described by a
 * {@link FrameLayout}, guarded by a read/write lock, plus the subscriber
 * machinery that publishes it.
 *
 * <h2>What subclasses provide</h2>
 * A concrete frame supplies its {@link FrameLayout} (usually a static
 * constant), its {@link #typeName()} and, optionally, typed convenience
 * accessors on top of {@link #getSignal(String)} / {@link #setSignal}.
 * Subclasses may register additional methods through
 * {@link #registerMethod(String, MethodFunction)}.
 *
 * <h2>Payload</h2>
 * The payload is zero-initialized at construction. It is only ever touched
 * through this class: readers hold the shared lock, writers the exclusive
 * lock. Raw views handed to {@link RawReader} / {@link RawWriter} use the
 * layout's byte order, start at position 0 with limit = {@link #size()}, and
 * are valid only for the duration of the call.
 *
 * <h2>Publishing</h2>
 * Writes never notify on their own. The {@code ...WithPublish} variants and
 * {@link #notifyCallbacks()} run direct callbacks on the caller's thread in
 * registration order, then hand every threaded subscriber a private
 * serialized snapshot. Direct callbacks receive this frame and may read it,
 * but must not write to it.
 *
 * <h2>Sharing</h2>
 * Holders (the frame bus, port connections, port subscriptions) call
 * {@link #retain()} and {@link #release()}. When the last holder lets go the
 * frame closes: every threaded worker is stopped and joined and no new
 * subscriptions are accepted. A frame that was never retained is closed
 * explicitly with {@link #close()}.
 */
public abstract class AbstractFrame implements Frame
{
    private static final Logger log = LoggerFactory.getLogger(AbstractFrame.class);

    private final String instanceName;
    private final FrameLayout layout;
    private final FrameBusObservabilitySink sink;

    private final ReentrantReadWriteLock payloadLock = new ReentrantReadWriteLock();
    private final ByteBuffer payload;
    private volatile FrameCodec codec = RawFrameCodec.INSTANCE;

    /**
     * Signal name to accessor, in layout order. Immutable after construction.
     */
    private final Map<String, SignalAccessor> signals;

    private final CallbackTable callbacks;
    private final DefaultMethodTable methods;

    private final AtomicInteger refCount = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    protected AbstractFrame(String instanceName, FrameLayout layout) {
        this(instanceName, layout, FrameBusConfig.defaults(), Slf4jFrameBusObservabilitySink.INSTANCE);
    }

    protected AbstractFrame(String instanceName,
                            FrameLayout layout,
                            FrameBusConfig config,
                            FrameBusObservabilitySink sink) {
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
        this.layout = Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (instanceName.isBlank()) {
            throw new IllegalArgumentException("Frame instance name must not be blank");
        }

        this.payload = ByteBuffer.allocate(layout.size()).order(layout.order());

        Map<String, SignalAccessor> accessors = new LinkedHashMap<>();
        for (SignalField field : layout.fields()) {
            accessors.put(field.name(), new SignalAccessor(field));
        }
        this.signals = Collections.unmodifiableMap(accessors);

        this.callbacks = new CallbackTable(instanceName, config, sink);
        this.methods = new DefaultMethodTable("frame '" + instanceName + "'");
        registerBuiltInMethods();
    }

    // -------------------------------------------------------------------------
    // Identity
    // -------------------------------------------------------------------------

    @Override
    public final String id() {
        return instanceName;
    }

    @Override
    public final int size() {
        return layout.size();
    }

    @Override
    public final FrameLayout layout() {
        return layout;
    }

    @Override
    public final Set<String> signalNames() {
        return signals.keySet();
    }

    // -------------------------------------------------------------------------
    // Raw access
    // -------------------------------------------------------------------------

    @Override
    public final void readRaw(RawReader reader) {
        Objects.requireNonNull(reader, "reader");
        payloadLock.readLock().lock();
        try {
            reader.read(readView());
        } finally {
            payloadLock.readLock().unlock();
        }
    }

    @Override
    public final void writeRaw(RawWriter writer) {
        Objects.requireNonNull(writer, "writer");
        payloadLock.writeLock().lock();
        try {
            writer.write(writeView());
        } finally {
            payloadLock.writeLock().unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Signals
    // -------------------------------------------------------------------------

    @Override
    public final SignalValue getSignal(String name) {
        return accessor(name).get();
    }

    @Override
    public final void setSignal(String name, SignalValue value) {
        accessor(name).set(value);
    }

    @Override
    public final void setSignalWithPublish(String name, SignalValue value) {
        setSignal(name, value);
        notifyCallbacks();
    }

    private SignalAccessor accessor(String name) {
        Objects.requireNonNull(name, "name");
        SignalAccessor accessor = signals.get(name);
        if (accessor == null) {
            throw new UnknownSignalException("Frame '" + instanceName + "' has no signal '" + name + "'");
        }
        return accessor;
    }

    // -------------------------------------------------------------------------
    // Serialization
    // -------------------------------------------------------------------------

    @Override
    public final byte[] serialize() {
        payloadLock.readLock().lock();
        try {
            return codec.serialize(readView());
        } finally {
            payloadLock.readLock().unlock();
        }
    }

    @Override
    public final void deserialize(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        payloadLock.writeLock().lock();
        try {
            codec.deserialize(bytes, writeView());
        } finally {
            payloadLock.writeLock().unlock();
        }
    }

    /**
     * Applies {@code bytes} through the installed codec, then publishes.
     *
     * <p>The result reports whether {@code bytes} was exactly {@link #size()}
     * bytes long; a custom codec may accept other lengths and still publish.
     * When the codec rejects the input with a {@link SizeMismatchException}
     * nothing is applied and nobody is notified.</p>
     */
    @Override
    public final boolean deserializeWithPublish(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        try {
            deserialize(bytes);
        } catch (SizeMismatchException e) {
            log.debug("Frame '{}': codec rejected {} byte(s), expected {}", instanceName, bytes.length, layout.size());
            return false;
        }
        notifyCallbacks();
        return bytes.length == layout.size();
    }

    @Override
    public final void installCodec(FrameCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    // -------------------------------------------------------------------------
    // Callbacks
    // -------------------------------------------------------------------------

    @Override
    public final long addCallback(FrameCallback callback, CallbackPolicy policy) {
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(policy, "policy");
        if (policy == CallbackPolicy.THREADED) {
            throw new InvalidPolicyException(
                    "Frame '" + instanceName + "': threaded subscribers receive snapshots; use addSnapshotCallback");
        }
        return callbacks.addDirect(callback);
    }

    @Override
    public final long addSnapshotCallback(SnapshotCallback callback) {
        long id = callbacks.addThreaded(callback);
        log.debug("Frame '{}': started snapshot worker for callback {}", instanceName, id);
        return id;
    }

    @Override
    public final boolean removeCallback(long callbackId) {
        return callbacks.remove(callbackId);
    }

    @Override
    public final void notifyCallbacks() {
        callbacks.publish(this, this::serialize);
    }

    @Override
    public final int callbackCount() {
        return callbacks.size();
    }

    // -------------------------------------------------------------------------
    // Sharing and lifecycle
    // -------------------------------------------------------------------------

    @Override
    public final Frame retain() {
        while (true) {
            if (closed.get()) {
                throw new IllegalStateException("Frame '" + instanceName + "' is closed");
            }
            int current = refCount.get();
            if (refCount.compareAndSet(current, current + 1)) {
                return this;
            }
        }
    }

    @Override
    public final boolean release() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                throw new IllegalStateException("Frame '" + instanceName + "' released more often than retained");
            }
            if (refCount.compareAndSet(current, current - 1)) {
                if (current == 1) {
                    close();
                    return true;
                }
                return false;
            }
        }
    }

    @Override
    public final int refCount() {
        return refCount.get();
    }

    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        callbacks.closeAll();
        log.debug("Frame '{}' closed", instanceName);
        sink.onFrameLifecycle(new FrameLifecycleEvent(Instant.now(), instanceName, FrameLifecycleEvent.Kind.CLOSED));
    }

    @Override
    public final boolean isClosed() {
        return closed.get();
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
        methods.registerMethod("id", args -> SignalValue.of(id()));
        methods.registerMethod("size", args -> SignalValue.of(size()));
        methods.registerMethod("getSignal",
                args -> getSignal(MethodArguments.text(args, 0, "getSignal")));
        methods.registerMethod("setSignal", args -> {
            setSignal(MethodArguments.text(args, 0, "setSignal"), MethodArguments.at(args, 1, "setSignal"));
            return SignalValue.none();
        });
        methods.registerMethod("setSignalWithPublish", args -> {
            setSignalWithPublish(
                    MethodArguments.text(args, 0, "setSignalWithPublish"),
                    MethodArguments.at(args, 1, "setSignalWithPublish"));
            return SignalValue.none();
        });
        methods.registerMethod("notify", args -> {
            notifyCallbacks();
            return SignalValue.none();
        });
        methods.registerMethod("serialize", args -> SignalValue.of(serialize()));
        methods.registerMethod("deserialize", args -> {
            deserialize(MethodArguments.bytes(args, 0, "deserialize"));
            return SignalValue.none();
        });
    }

    // -------------------------------------------------------------------------
    // Views
    // -------------------------------------------------------------------------

    private ByteBuffer readView() {
        return payload.asReadOnlyBuffer().order(layout.order());
    }

    private ByteBuffer writeView() {
        return payload.duplicate().order(layout.order());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + instanceName + ", " + layout.size() + " bytes]";
    }

    /**
     * Getter/setter pair bound to one field and to the payload lock.
     */
    private final class SignalAccessor
    {
        private final SignalField field;

        SignalAccessor(SignalField field) {
            this.field = field;
        }

        SignalValue get() {
            payloadLock.readLock().lock();
            try {
                return field.read(payload);
            } finally {
                payloadLock.readLock().unlock();
            }
        }

        void set(SignalValue value) {
            Objects.requireNonNull(value, "value");
            payloadLock.writeLock().lock();
            try {
                field.write(payload, value);
            } finally {
                payloadLock.writeLock().unlock();
            }
        }
    }
}
