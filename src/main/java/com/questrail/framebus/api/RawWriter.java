package com.questrail.framebus.api;

import java.nio.ByteBuffer;

/**
 * Scoped write access to a frame payload.
 *
 * <p>The buffer is a writable view positioned at 0 with its limit at the
 * payload size, using the layout's byte order. It is valid only for the
 * duration of the call and must not be retained.</p>
 */
@FunctionalInterface
public interface RawWriter
{
    void write(ByteBuffer payload);
}
