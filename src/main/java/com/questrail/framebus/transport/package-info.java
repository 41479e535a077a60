/**
 * Frame bus transport ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty UDP, a simulator, a test double) and the ports that bridge frames
 * onto the wire.
 *
 * <h2>Netty containment</h2>
 * Netty is used for the production UDP endpoint, but its types stay in
 * {@code transport.udp.netty}. Everything above an endpoint sees only:
 * <ul>
 *   <li>raw datagram payloads as {@code byte[]}</li>
 *   <li>remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Endpoints perform I/O only. They do not decode frame packets, touch frames,
 * or retry sends; all of that lives in the port.
 */
package com.questrail.framebus.transport;
