package com.questrail.framebus.api;

/**
 * Threaded-policy callback receiving a serialized payload snapshot.
 *
 * <p>The array belongs to the callback; it is not shared with other
 * subscribers.</p>
 */
@FunctionalInterface
public interface SnapshotCallback
{
    void onSnapshot(byte[] snapshot, int length);
}
