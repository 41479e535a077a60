package com.questrail.framebus.layout;

import com.questrail.framebus.error.SizeMismatchException;

import java.nio.ByteBuffer;

/**
 * Default {@link FrameCodec}: copies the payload byte for byte.
 *
 * <p>{@link #deserialize(byte[], ByteBuffer)} rejects input whose length is not
 * exactly the payload size; the payload is left untouched in that case.</p>
 */
public final class RawFrameCodec implements FrameCodec
{
    public static final RawFrameCodec INSTANCE = new RawFrameCodec();

    private RawFrameCodec() {}

    @Override
    public byte[] serialize(ByteBuffer payload) {
        byte[] out = new byte[payload.remaining()];
        payload.get(payload.position(), out);
        return out;
    }

    @Override
    public void deserialize(byte[] input, ByteBuffer payload) {
        int expected = payload.remaining();
        if (input.length != expected) {
            throw new SizeMismatchException("deserialize", expected, input.length);
        }
        payload.put(payload.position(), input);
    }
}
