package com.questrail.framebus.api;

/**
 * Port-level subscriber shape: raw payload bytes plus their length.
 *
 * <p>The same shape is used for direct and threaded subscriptions so that
 * transport code does not need to know which policy delivered the data.</p>
 */
@FunctionalInterface
public interface FrameDataListener
{
    void onFrameData(byte[] data, int length);
}
