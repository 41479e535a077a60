package com.questrail.framebus.api;

import java.nio.ByteBuffer;

/**
 * Scoped read access to a frame payload.
 *
 * <p>The buffer is a read-only view positioned at 0 with its limit at the
 * payload size. It is valid only for the duration of the call and must not
 * be retained.</p>
 */
@FunctionalInterface
public interface RawReader
{
    void read(ByteBuffer payload);
}
