package com.socialintel.collector.service;

import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.model.JobParameters;
import com.socialintel.collector.model.Metrics;
import com.socialintel.collector.model.Phase;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns phase counters into one overall percentage.
 *
 * <p>Each phase contributes {@code weight × clamp(processed / total, 0, 1)}. A phase whose total is
 * still 0 has not started and contributes nothing, so it cannot report itself done early. Because
 * every ratio is clamped, counters that overshoot their total (concurrent increments, or an
 * estimated comment total revised downward) can neither push the result above 100 nor below 0.
 *
 * <p>The percentage functions are pure; the instance only carries configured weights and the
 * averages used to estimate the comment total before real post counts exist.
 */
@Component
public class ProgressCalculator {

    private final ProgressWeights weights;
    private final int avgPostsPerGroup;
    private final int avgCommentsPerPost;
    private final long minEstimatedTotal;

    @Autowired
    public ProgressCalculator(CollectorProperties properties) {
        this(new ProgressWeights(
                        properties.getProgress().getWeights().getGroups(),
                        properties.getProgress().getWeights().getPosts(),
                        properties.getProgress().getWeights().getComments()),
                properties.getProgress().getAvgPostsPerGroup(),
                properties.getProgress().getAvgCommentsPerPost(),
                properties.getProgress().getMinEstimatedTotal());
    }

    public ProgressCalculator(ProgressWeights weights, int avgPostsPerGroup, int avgCommentsPerPost,
                              long minEstimatedTotal) {
        this.weights = weights;
        this.avgPostsPerGroup = avgPostsPerGroup;
        this.avgCommentsPerPost = avgCommentsPerPost;
        this.minEstimatedTotal = minEstimatedTotal;
    }

    public int percentage(Metrics metrics) {
        return percentage(metrics, weights);
    }

    /**
     * @return {@code round(Σ weight × ratio × 100)}, always within [0, 100]
     */
    public static int percentage(Metrics metrics, ProgressWeights weights) {
        double weighted = 0;
        for (Phase phase : Phase.values()) {
            weighted += weights.of(phase) * ratio(metrics, phase);
        }
        long rounded = Math.round(weighted * 100);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    /** Completion of one phase, clamped to [0, 1]; 0 while the phase total is unknown. */
    public static double ratio(Metrics metrics, Phase phase) {
        long total = metrics.total(phase);
        if (total <= 0) {
            return 0;
        }
        double ratio = (double) metrics.processed(phase) / total;
        return Math.max(0, Math.min(1, ratio));
    }

    /**
     * A-priori comment total for a job: groups × average posts per group × average comments per post,
     * or the job's cap when that is smaller. Uncapped estimates never go below the configured minimum.
     */
    public long estimateTotal(int groupCount, Integer maxComments) {
        long estimated = (long) groupCount * avgPostsPerGroup * avgCommentsPerPost;
        if (maxComments != null && maxComments > 0) {
            return Math.min(estimated, maxComments);
        }
        return Math.max(estimated, minEstimatedTotal);
    }

    public long estimateTotal(JobParameters parameters) {
        return estimateTotal(parameters.seedGroupCount(), parameters.maxComments());
    }

    public int getAvgCommentsPerPost() {
        return avgCommentsPerPost;
    }

    /**
     * Human-readable notes about inconsistent counters. Never throws: a job with odd counters still gets
     * a bounded percentage.
     */
    public static List<String> validateMetrics(Metrics metrics) {
        List<String> warnings = new ArrayList<>();
        for (Phase phase : Phase.values()) {
            long total = metrics.total(phase);
            long processed = metrics.processed(phase);
            if (total > 0 && processed > total) {
                warnings.add(String.format("%s phase: processed (%d) exceeds total (%d)",
                        phase.wireName(), processed, total));
            } else if (total == 0 && processed > 0) {
                warnings.add(String.format("%s phase: processed (%d) while total is unknown",
                        phase.wireName(), processed));
            }
        }
        return warnings;
    }
}
