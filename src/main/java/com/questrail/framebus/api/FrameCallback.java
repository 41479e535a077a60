package com.questrail.framebus.api;

/**
 * Direct-policy callback.
 *
 * <p>Runs on the publisher's thread and receives the live frame. It may read
 * the frame ({@link Frame#readRaw}, {@link Frame#getSignal}) but must not block
 * and must not write to the same frame.</p>
 */
@FunctionalInterface
public interface FrameCallback
{
    void onPublish(Frame frame);
}
