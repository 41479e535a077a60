package com.questrail.framebus.transport.udp;

import com.questrail.framebus.api.Frame;
import com.questrail.framebus.api.Port;
import com.questrail.framebus.config.UdpPortConfig;
import com.questrail.framebus.core.AbstractPort;
import com.questrail.framebus.registry.FrameBus;
import com.questrail.framebus.registry.TypeDescriptor;
import com.questrail.framebus.transport.DatagramEndpoint;
import com.questrail.framebus.transport.DatagramEndpointListener;
import com.questrail.framebus.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * UdpFramePort
 * =============================================================================
 * Port that bridges frames between buses over UDP datagrams.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   Frame publish
 *        → threaded subscription (snapshot)
 *            → FramePacketCodec.encode
 *                → DatagramEndpoint.send(remote, ...)
 * </pre>
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → FramePacketCodec.decode
 *            → setRawDataToFrameWithPublish(frameName, payload)
 * </pre>
 *
 * <h2>Directions</h2>
 * A frame is either exported (its publications go out) or imported (inbound
 * packets are applied to it), chosen per frame with {@link #exportFrame} and
 * {@link #importFrame}; one port refuses to do both for the same frame.
 * Inbound packets for frames that were not imported are dropped. Two ports on
 * the same bus, one importing and one exporting a frame, do relay every
 * applied packet: an inbound apply publishes like any other write.
 *
 * <h2>Defects</h2>
 * Malformed datagrams and packets whose payload size does not match the frame
 * are dropped and counted. They never turn into bus errors.
 */
public final class UdpFramePort extends AbstractPort implements DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(UdpFramePort.class);

    public static final String TYPE_NAME = "UdpFramePort";
    public static final String TRANSPORT = "udp";

    private final UdpPortConfig config;
    private final DatagramEndpoint endpoint;

    /**
     * Exported frame name to port subscription id.
     */
    private final Map<String, Long> exports = new ConcurrentHashMap<>();
    private final Set<String> imports = ConcurrentHashMap.newKeySet();

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean transportUp;

    public UdpFramePort(String instanceName, FrameBus frameBus, UdpPortConfig config, DatagramEndpoint endpoint) {
        super(instanceName, frameBus);
        this.config = Objects.requireNonNull(config, "config");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");

        // The endpoint is the raw I/O surface; this port is the translation layer.
        this.endpoint.setListener(this);
    }

    /**
     * Descriptor for a port backed by a {@link NettyUdpDatagramEndpoint} bound
     * to {@code config.bindAddress()}.
     */
    public static TypeDescriptor<Port> descriptor(UdpPortConfig config) {
        Objects.requireNonNull(config, "config");
        return TypeDescriptor.of(TYPE_NAME, (name, context) -> new UdpFramePort(
                name, context.frameBus(), config, new NettyUdpDatagramEndpoint(config.bindAddress())));
    }

    @Override
    public String type() {
        return TRANSPORT;
    }

    @Override
    public String typeName() {
        return TYPE_NAME;
    }

    public UdpPortConfig config() {
        return config;
    }

    /**
     * Address this port receives on; the actual port once opened.
     */
    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    public boolean isTransportUp() {
        return transportUp;
    }

    public long sentPackets() {
        return sent.get();
    }

    public long appliedPackets() {
        return applied.get();
    }

    public long droppedPackets() {
        return dropped.get();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public boolean open() {
        try {
            endpoint.start();
        } catch (RuntimeException e) {
            log.warn("Port '{}': endpoint failed to start on {}", name(), config.bindAddress(), e);
            return false;
        }
        log.info("Port '{}' opened on {}", name(), endpoint.localAddress());
        return true;
    }

    @Override
    public void close() {
        exports.keySet().forEach(this::unexportFrame);
        imports.clear();
        release();
        endpoint.stop();
        log.info("Port '{}' closed (sent={}, applied={}, dropped={})",
                name(), sent.get(), applied.get(), dropped.get());
    }

    // -------------------------------------------------------------------------
    // Directions
    // -------------------------------------------------------------------------

    /**
     * Connects {@code frameName} and sends every publication of it to the
     * remote address.
     *
     * @return {@code false} if the frame is not on the bus, is imported by this
     *         port, or does not fit a {@link FramePacket}
     * @throws IllegalStateException if no remote address is configured
     */
    public boolean exportFrame(String frameName) {
        Objects.requireNonNull(frameName, "frameName");
        InetSocketAddress remote = config.remote().orElseThrow(
                () -> new IllegalStateException("Port '" + name() + "' has no remote address to export to"));

        if (exports.containsKey(frameName)) {
            return true;
        }
        if (imports.contains(frameName)) {
            log.warn("Port '{}': frame '{}' is imported, refusing to export it", name(), frameName);
            return false;
        }
        Optional<Frame> frame = frameBus().get(frameName);
        if (frame.isPresent() && !FramePacket.fits(frameName, frame.get().size())) {
            log.warn("Port '{}': frame '{}' ({} bytes) does not fit a packet, refusing to export it",
                    name(), frameName, frame.get().size());
            return false;
        }
        if (!connectFrame(frameName)) {
            return false;
        }
        long subscriptionId = subscribeFrame(frameName,
                (data, length) -> sendSnapshot(remote, frameName, data, length));
        if (subscriptionId == 0) {
            return false;
        }
        exports.put(frameName, subscriptionId);
        log.debug("Port '{}' exporting frame '{}' to {}", name(), frameName, remote);
        return true;
    }

    public boolean unexportFrame(String frameName) {
        Long subscriptionId = exports.remove(frameName);
        return subscriptionId != null && unsubscribeFrame(subscriptionId);
    }

    /**
     * Connects {@code frameName} and applies inbound packets for it.
     *
     * @return {@code false} if the frame is not on the bus or is exported by
     *         this port
     */
    public boolean importFrame(String frameName) {
        Objects.requireNonNull(frameName, "frameName");
        if (exports.containsKey(frameName)) {
            log.warn("Port '{}': frame '{}' is exported, refusing to import it", name(), frameName);
            return false;
        }
        if (!connectFrame(frameName)) {
            return false;
        }
        imports.add(frameName);
        log.debug("Port '{}' importing frame '{}'", name(), frameName);
        return true;
    }

    public boolean unimportFrame(String frameName) {
        return imports.remove(frameName);
    }

    public Set<String> exportedFrames() {
        return Set.copyOf(exports.keySet());
    }

    public Set<String> importedFrames() {
        return Set.copyOf(imports);
    }

    private void sendSnapshot(SocketAddress remote, String frameName, byte[] data, int length) {
        byte[] payload = length == data.length ? data : Arrays.copyOf(data, length);
        endpoint.send(remote, FramePacketCodec.encode(new FramePacket(frameName, payload)));
        sent.incrementAndGet();
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportUp = true;
        log.info("Port '{}': transport up", name());
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportUp = false;
        if (cause != null) {
            log.warn("Port '{}': transport down", name(), cause);
        } else {
            log.info("Port '{}': transport down", name());
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Optional<FramePacket> packet = FramePacketCodec.decode(payload);
        if (packet.isEmpty()) {
            dropped.incrementAndGet();
            log.debug("Port '{}': dropped malformed datagram from {}", name(), remote);
            return;
        }

        String frameName = packet.get().frameName();
        if (!imports.contains(frameName)) {
            dropped.incrementAndGet();
            log.debug("Port '{}': dropped packet for frame '{}' (not imported)", name(), frameName);
            return;
        }
        if (!setRawDataToFrameWithPublish(frameName, packet.get().payload())) {
            dropped.incrementAndGet();
            log.debug("Port '{}': dropped packet rejected by frame '{}'", name(), frameName);
            return;
        }
        applied.incrementAndGet();
    }
}
