package com.socialintel.collector.client;

/**
 * Quota gate in front of every external call.
 */
public interface RateLimiter {

    /**
     * Blocks the calling thread until a slot is available, then takes it. Never drops the caller.
     *
     * @throws IllegalStateException if the thread is interrupted while waiting
     */
    void acquire();
}
