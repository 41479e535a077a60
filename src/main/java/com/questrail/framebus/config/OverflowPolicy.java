package com.questrail.framebus.config;

/**
 * What a threaded subscriber's snapshot queue does when it is full.
 */
public enum OverflowPolicy
{
    /**
     * Discard the oldest queued snapshot to make room. The subscriber always
     * sees the most recent state; intermediate states may be skipped.
     */
    DROP_OLDEST,

    /**
     * Discard the snapshot being published. Queued snapshots are kept.
     */
    DROP_NEWEST,

    /**
     * Block the publishing thread until the worker frees a slot or the
     * subscriber is removed. Nothing is dropped while the subscriber lives.
     */
    BLOCK_PUBLISHER
}
