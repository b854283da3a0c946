package com.socialintel.collector.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters of a running job. Phase workers update them concurrently, so every mutation is a
 * single atomic operation. Totals are clamped at zero when corrected downward.
 */
public class PhaseCounters {

    private final AtomicLong groupsTotal = new AtomicLong();
    private final AtomicLong groupsProcessed = new AtomicLong();
    private final AtomicLong postsTotal = new AtomicLong();
    private final AtomicLong postsProcessed = new AtomicLong();
    private final AtomicLong commentsTotal = new AtomicLong();
    private final AtomicLong commentsProcessed = new AtomicLong();
    private final AtomicInteger estimatedCommentsPerPost = new AtomicInteger();

    public static PhaseCounters from(Metrics metrics) {
        PhaseCounters counters = new PhaseCounters();
        counters.groupsTotal.set(metrics.groupsTotal());
        counters.groupsProcessed.set(metrics.groupsProcessed());
        counters.postsTotal.set(metrics.postsTotal());
        counters.postsProcessed.set(metrics.postsProcessed());
        counters.commentsTotal.set(metrics.commentsTotal());
        counters.commentsProcessed.set(metrics.commentsProcessed());
        counters.estimatedCommentsPerPost.set(metrics.estimatedCommentsPerPost());
        return counters;
    }

    public void setTotal(Phase phase, long total) {
        totalOf(phase).set(Math.max(0, total));
    }

    public void addToTotal(Phase phase, long delta) {
        totalOf(phase).accumulateAndGet(delta, (current, d) -> Math.max(0, current + d));
    }

    public void addProcessed(Phase phase, long delta) {
        if (delta > 0) {
            processedOf(phase).addAndGet(delta);
        }
    }

    public void setEstimatedCommentsPerPost(int value) {
        estimatedCommentsPerPost.set(Math.max(0, value));
    }

    public Metrics snapshot() {
        return new Metrics(
                groupsTotal.get(),
                groupsProcessed.get(),
                postsTotal.get(),
                postsProcessed.get(),
                commentsTotal.get(),
                commentsProcessed.get(),
                estimatedCommentsPerPost.get());
    }

    private AtomicLong totalOf(Phase phase) {
        return switch (phase) {
            case GROUPS -> groupsTotal;
            case POSTS -> postsTotal;
            case COMMENTS -> commentsTotal;
        };
    }

    private AtomicLong processedOf(Phase phase) {
        return switch (phase) {
            case GROUPS -> groupsProcessed;
            case POSTS -> postsProcessed;
            case COMMENTS -> commentsProcessed;
        };
    }
}
