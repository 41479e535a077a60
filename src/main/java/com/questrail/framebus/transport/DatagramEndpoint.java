package com.questrail.framebus.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Datagram transport underneath a frame port (UDP-style).
 *
 * <p>Implementations may be backed by Netty or a test harness. The frame port
 * on top is responsible for packet encoding and for applying inbound data to
 * frames.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>Activation is reported through
     * {@link DatagramEndpointListener#onTransportUp()}, once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>Reported through {@link DatagramEndpointListener#onTransportDown(Throwable)}
     * at most once per transition.</p>
     */
    void stop();

    /**
     * Send one datagram. Sends issued before the transport is up are dropped.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Address the endpoint receives on. Before {@link #start()} this is the
     * configured bind address, which may still carry the ephemeral port 0.
     */
    SocketAddress localAddress();

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
