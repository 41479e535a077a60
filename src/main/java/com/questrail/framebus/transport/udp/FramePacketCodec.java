package com.questrail.framebus.transport.udp;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * FramePacketCodec
 * -----------------------------------------------------------------------------
 * Wire format of {@link FramePacket}:
 *
 * <pre>
 *   u8   magic        0xFB
 *   u8   nameLength   1..255
 *   ...  name         UTF-8
 *   u16  payloadLength (big-endian)
 *   ...  payload
 * </pre>
 *
 * <p>Decoding never throws on wire-level defects: a wrong magic byte, a
 * truncated or over-long datagram, or a name that is not valid UTF-8 yields
 * {@link Optional#empty()} and the datagram is dropped.</p>
 */
public final class FramePacketCodec
{
    public static final int MAGIC = 0xFB;

    private static final int HEADER_BYTES = 2;
    private static final int LENGTH_BYTES = 2;

    private FramePacketCodec() {}

    public static byte[] encode(FramePacket packet) {
        byte[] name = packet.frameName().getBytes(StandardCharsets.UTF_8);
        byte[] payload = packet.payload();

        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + name.length + LENGTH_BYTES + payload.length)
                .order(ByteOrder.BIG_ENDIAN);
        out.put((byte) MAGIC);
        out.put((byte) name.length);
        out.put(name);
        out.putShort((short) payload.length);
        out.put(payload);
        return out.array();
    }

    public static Optional<FramePacket> decode(byte[] datagram) {
        if (datagram == null || datagram.length < HEADER_BYTES + 1 + LENGTH_BYTES) {
            return Optional.empty();
        }

        ByteBuffer in = ByteBuffer.wrap(datagram).order(ByteOrder.BIG_ENDIAN);
        if ((in.get() & 0xFF) != MAGIC) {
            return Optional.empty();
        }

        int nameLength = in.get() & 0xFF;
        if (nameLength == 0 || in.remaining() < nameLength + LENGTH_BYTES) {
            return Optional.empty();
        }
        byte[] name = new byte[nameLength];
        in.get(name);

        int payloadLength = in.getShort() & 0xFFFF;
        if (in.remaining() != payloadLength) {
            return Optional.empty();
        }
        byte[] payload = new byte[payloadLength];
        in.get(payload);

        final String frameName;
        try {
            frameName = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(name))
                    .toString();
        } catch (CharacterCodingException e) {
            // Wire-level failure: drop datagram
            return Optional.empty();
        }

        return Optional.of(new FramePacket(frameName, payload));
    }
}
