package com.questrail.framebus.api;

/**
 * Delivery policy of a frame callback.
 */
public enum CallbackPolicy
{
    /**
     * Invoked synchronously on the publishing thread, in registration order,
     * before {@code notifyCallbacks()} returns.
     */
    DIRECT,

    /**
     * Invoked on a dedicated worker thread with a snapshot of the payload taken
     * at publish time. Snapshots are delivered FIFO per subscriber.
     */
    THREADED
}
