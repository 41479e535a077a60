package com.questrail.framebus.layout;

import java.nio.ByteBuffer;

/**
 * FrameCodec
 * -----------------------------------------------------------------------------
 * Serializer/deserializer pair installed on a frame.
 *
 * <p>The frame calls the codec while holding the matching payload lock: the
 * read lock for {@link #serialize(ByteBuffer)}, the write lock for
 * {@link #deserialize(byte[], ByteBuffer)}. The buffers are scoped views over
 * the payload (position 0, limit = payload size) and must not be retained.</p>
 *
 * <p>The default codec is {@link RawFrameCodec}: a byte-for-byte copy.</p>
 */
public interface FrameCodec
{
    /**
     * Produces the external representation of {@code payload}.
     */
    byte[] serialize(ByteBuffer payload);

    /**
     * Applies {@code input} to {@code payload}.
     */
    void deserialize(byte[] input, ByteBuffer payload);
}
