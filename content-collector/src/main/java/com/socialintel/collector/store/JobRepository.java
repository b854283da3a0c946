package com.socialintel.collector.store;

import com.socialintel.collector.model.Job;
import com.socialintel.collector.model.JobStatus;
import com.socialintel.collector.model.Metrics;
import com.socialintel.collector.model.Phase;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of job records.
 */
public interface JobRepository {

    /** Creates the backing table if it does not exist. */
    void ensureSchema();

    /** Inserts or fully overwrites the stored record. */
    void save(Job job);

    Optional<Job> findById(String jobId);

    List<Job> findByStatus(JobStatus status);

    /**
     * Atomically moves a stored job from {@code expected} to {@code next}.
     *
     * @return false if the stored status was not {@code expected}
     */
    boolean compareAndSetStatus(String jobId, JobStatus expected, JobStatus next, Instant at);

    /** Writes only the counters and the current phase of a running job. Ignored once the job is no longer PROCESSING. */
    void updateProgress(String jobId, Metrics metrics, Phase phase);
}
