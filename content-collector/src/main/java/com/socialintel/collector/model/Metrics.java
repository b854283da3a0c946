package com.socialintel.collector.model;

/**
 * Point-in-time phase counters of a job.
 *
 * Counters are never negative, but {@code processed > total} is legal: totals can be estimates
 * that are revised downward while work runs, and concurrent increments may overtake a total.
 * Readers clamp; see {@link com.socialintel.collector.service.ProgressCalculator}.
 */
public record Metrics(
        long groupsTotal,
        long groupsProcessed,
        long postsTotal,
        long postsProcessed,
        long commentsTotal,
        long commentsProcessed,
        int estimatedCommentsPerPost
) {

    public static final Metrics EMPTY = new Metrics(0, 0, 0, 0, 0, 0, 0);

    public Metrics {
        requireNonNegative("groupsTotal", groupsTotal);
        requireNonNegative("groupsProcessed", groupsProcessed);
        requireNonNegative("postsTotal", postsTotal);
        requireNonNegative("postsProcessed", postsProcessed);
        requireNonNegative("commentsTotal", commentsTotal);
        requireNonNegative("commentsProcessed", commentsProcessed);
        requireNonNegative("estimatedCommentsPerPost", estimatedCommentsPerPost);
    }

    public long total(Phase phase) {
        return switch (phase) {
            case GROUPS -> groupsTotal;
            case POSTS -> postsTotal;
            case COMMENTS -> commentsTotal;
        };
    }

    public long processed(Phase phase) {
        return switch (phase) {
            case GROUPS -> groupsProcessed;
            case POSTS -> postsProcessed;
            case COMMENTS -> commentsProcessed;
        };
    }

    private static void requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative, was " + value);
        }
    }
}
