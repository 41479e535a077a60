package com.questrail.framebus.transport.udp;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * FramePacket
 * -----------------------------------------------------------------------------
 * One frame snapshot as carried in a UDP datagram: the frame's bus name plus
 * its raw payload.
 *
 * <p>The payload array is copied on the way in and on the way out.</p>
 */
public final class FramePacket
{
    /**
     * Longest frame name that fits the one-byte length field.
     */
    public static final int MAX_NAME_BYTES = 0xFF;

    /**
     * Largest payload that fits the two-byte length field.
     */
    public static final int MAX_PAYLOAD_BYTES = 0xFFFF;

    private final String frameName;
    private final byte[] payload;

    public FramePacket(String frameName, byte[] payload) {
        this.frameName = Objects.requireNonNull(frameName, "frameName");
        Objects.requireNonNull(payload, "payload");
        if (!fitsName(frameName)) {
            throw new IllegalArgumentException("Frame name must be 1.." + MAX_NAME_BYTES + " UTF-8 bytes: '" + frameName + "'");
        }
        if (payload.length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Payload too large: " + payload.length + " bytes");
        }
        this.payload = payload.clone();
    }

    /**
     * Whether a frame called {@code frameName} with a payload of
     * {@code payloadLength} bytes can be carried in one packet.
     */
    public static boolean fits(String frameName, int payloadLength) {
        return fitsName(frameName) && payloadLength >= 0 && payloadLength <= MAX_PAYLOAD_BYTES;
    }

    private static boolean fitsName(String frameName) {
        return !frameName.isEmpty() && frameName.getBytes(StandardCharsets.UTF_8).length <= MAX_NAME_BYTES;
    }

    public String frameName() {
        return frameName;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    @Override
    public String toString() {
        return "FramePacket[frame=" + frameName + ", payloadLength=" + payload.length + ']';
    }
}
