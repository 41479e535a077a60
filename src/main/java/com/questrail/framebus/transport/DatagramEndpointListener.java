package com.questrail.framebus.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially by the endpoint; the Netty endpoint
 * delivers them on its channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause; {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * One complete datagram, copied out of any framework buffer.
     *
     * @param remote  sender
     * @param payload raw datagram bytes
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
