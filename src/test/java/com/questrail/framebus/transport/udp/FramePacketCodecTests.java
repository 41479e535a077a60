package com.questrail.framebus.transport.udp;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FramePacketCodecTests
{
    @Test
    void encodeWritesMagicNameAndBigEndianLength() {
        byte[] bytes = FramePacketCodec.encode(new FramePacket("S1", new byte[] {9, 8, 7}));

        assertArrayEquals(new byte[] {
                (byte) 0xFB,
                2, 'S', '1',
                0, 3,
                9, 8, 7
        }, bytes);
    }

    @Test
    void decodeRecoversTheNameAndPayload() {
        byte[] payload = new byte[300];
        payload[299] = 1;
        byte[] bytes = FramePacketCodec.encode(new FramePacket("Sensor1", payload));

        FramePacket packet = FramePacketCodec.decode(bytes).orElseThrow();

        assertEquals("Sensor1", packet.frameName());
        assertArrayEquals(payload, packet.payload());
        assertEquals(300, packet.payloadLength());
    }

    @Test
    void malformedDatagramsAreDropped() {
        byte[] good = FramePacketCodec.encode(new FramePacket("S1", new byte[] {1, 2}));

        byte[] wrongMagic = good.clone();
        wrongMagic[0] = (byte) 0xF1;
        byte[] truncated = Arrays.copyOf(good, good.length - 1);
        byte[] trailing = Arrays.copyOf(good, good.length + 1);
        byte[] emptyName = {(byte) 0xFB, 0, 0, 0, 0};
        byte[] badUtf8 = {(byte) 0xFB, 1, (byte) 0xC3, 0, 0};

        assertEquals(Optional.empty(), FramePacketCodec.decode(new byte[0]));
        assertEquals(Optional.empty(), FramePacketCodec.decode(wrongMagic));
        assertEquals(Optional.empty(), FramePacketCodec.decode(truncated));
        assertEquals(Optional.empty(), FramePacketCodec.decode(trailing));
        assertEquals(Optional.empty(), FramePacketCodec.decode(emptyName));
        assertEquals(Optional.empty(), FramePacketCodec.decode(badUtf8));
    }

    @Test
    void packetRejectsNamesAndPayloadsThatDoNotFitTheHeader() {
        assertThrows(IllegalArgumentException.class, () -> new FramePacket("", new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new FramePacket("x".repeat(256), new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new FramePacket("x", new byte[0x10000]));
    }

    @Test
    void packetPayloadIsCopiedInAndOut() {
        byte[] payload = {1, 2};
        FramePacket packet = new FramePacket("S1", payload);
        payload[0] = 9;
        packet.payload()[1] = 9;

        assertArrayEquals(new byte[] {1, 2}, packet.payload());
    }
}
