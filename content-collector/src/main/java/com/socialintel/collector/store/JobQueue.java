package com.socialintel.collector.store;

import java.util.Optional;

/**
 * Queue of job ids waiting for a worker, highest priority first. Delivery is at-least-once;
 * workers skip jobs that are no longer PENDING.
 */
public interface JobQueue {

    void enqueue(String jobId, int priority);

    /** Next job id without waiting, if any. */
    Optional<String> poll();

    boolean remove(String jobId);

    int size();
}
