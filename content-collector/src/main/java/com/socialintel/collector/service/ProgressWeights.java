package com.socialintel.collector.service;

import com.socialintel.collector.model.Phase;

/**
 * Share of the overall percentage each phase contributes. Non-negative and summing to 1.
 */
public record ProgressWeights(double groups, double posts, double comments) {

    public static final ProgressWeights DEFAULT = new ProgressWeights(0.10, 0.30, 0.60);

    private static final double TOLERANCE = 1e-6;

    public ProgressWeights {
        if (groups < 0 || posts < 0 || comments < 0) {
            throw new IllegalArgumentException("Phase weights must not be negative: " + groups + ", " + posts + ", " + comments);
        }
        double sum = groups + posts + comments;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Phase weights must sum to 1.0, got " + sum);
        }
    }

    public double of(Phase phase) {
        return switch (phase) {
            case GROUPS -> groups;
            case POSTS -> posts;
            case COMMENTS -> comments;
        };
    }
}
