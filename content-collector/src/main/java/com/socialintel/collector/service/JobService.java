package com.socialintel.collector.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialintel.collector.model.Job;
import com.socialintel.collector.model.JobParameters;
import com.socialintel.collector.model.JobStatus;
import com.socialintel.collector.model.JobStatusView;
import com.socialintel.collector.model.JobSubmission;
import com.socialintel.collector.model.JobType;
import com.socialintel.collector.model.Metrics;
import com.socialintel.collector.store.JobQueue;
import com.socialintel.collector.store.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for the routing layer: submit, inspect, cancel and re-run jobs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobService {

    static final String INTERRUPTED_BY_RESTART = "interrupted by restart";

    private final JobRepository jobRepository;
    private final JobQueue jobQueue;
    private final JobParametersValidator validator;
    private final ProgressCalculator progressCalculator;
    private final CancellationRegistry cancellations;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Validates and stores a new PENDING job, then queues it.
     *
     * @throws JobValidationException if the type is unknown or the parameters do not fit it
     */
    public Job submit(JobSubmission submission) {
        JobType type;
        try {
            type = JobType.fromWireName(submission.type());
        } catch (IllegalArgumentException e) {
            throw new JobValidationException(e.getMessage());
        }

        JobParameters parameters = parseParameters(type, submission.parameters());
        validator.validate(parameters);

        int priority = submission.priority() == null ? 0 : submission.priority();
        Job job = Job.create(parameters, priority, submission.owner(), clock.instant());
        jobRepository.save(job);
        jobQueue.enqueue(job.getId(), job.getPriority());
        log.info("Accepted {} job {} (priority {}, owner {})",
                type.wireName(), job.getId(), priority, job.getOwner());
        return job;
    }

    /**
     * Current state of a job. The percentage is always within [0, 100]; a completed job reports 100.
     *
     * @throws JobNotFoundException if no such job exists
     */
    public JobStatusView status(String jobId) {
        Job job = find(jobId);
        Metrics metrics = job.metrics();
        int percentage = job.getStatus() == JobStatus.COMPLETED ? 100 : progressCalculator.percentage(metrics);
        List<String> warnings = ProgressCalculator.validateMetrics(metrics);
        if (!warnings.isEmpty()) {
            log.debug("Job {} counters are inconsistent: {}", jobId, warnings);
        }
        return new JobStatusView(job.getId(), job.getType(), job.getStatus(), job.getCurrentPhase(),
                percentage, metrics, job.getLastError(), warnings, job.getResult());
    }

    /**
     * Requests cancellation. A running job stops cooperatively; a queued job is cancelled at once.
     *
     * @throws JobNotFoundException  if no such job exists
     * @throws IllegalStateException if the job already finished
     */
    public void cancel(String jobId) {
        if (cancellations.cancel(jobId, "cancelled by request")) {
            return;
        }
        Job job = find(jobId);
        if (job.getStatus() == JobStatus.PENDING
                && jobRepository.compareAndSetStatus(jobId, JobStatus.PENDING, JobStatus.CANCELLED, clock.instant())) {
            jobQueue.remove(jobId);
            log.info("Job {} cancelled before it started", jobId);
            return;
        }
        // lost a race with a worker claiming it; the token is registered before the claim
        if (cancellations.cancel(jobId, "cancelled by request")) {
            return;
        }
        Job current = find(jobId);
        throw new IllegalStateException("Job " + jobId + " is already " + current.getStatus().wireName());
    }

    /**
     * Re-runs a finished job as a new PENDING job with the same request.
     *
     * @throws IllegalStateException if the job has not finished
     */
    public Job requeue(String jobId) {
        Job original = find(jobId);
        Job copy = original.copyForRequeue(clock.instant());
        jobRepository.save(copy);
        jobQueue.enqueue(copy.getId(), copy.getPriority());
        log.info("Job {} requeued as {}", jobId, copy.getId());
        return copy;
    }

    /**
     * Rebuilds the in-process queue from the job table. PENDING jobs are queued again; PROCESSING jobs
     * belonged to a process that no longer exists and are marked FAILED.
     */
    public void recoverOnStartup() {
        Instant now = clock.instant();
        List<Job> stale = jobRepository.findByStatus(JobStatus.PROCESSING);
        for (Job job : stale) {
            job.fail(INTERRUPTED_BY_RESTART);
            job.transitionTo(JobStatus.FAILED, now);
            jobRepository.save(job);
        }
        List<Job> pending = jobRepository.findByStatus(JobStatus.PENDING);
        pending.forEach(job -> jobQueue.enqueue(job.getId(), job.getPriority()));
        log.info("Recovered {} pending jobs, failed {} interrupted jobs", pending.size(), stale.size());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Job find(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private JobParameters parseParameters(JobType type, JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            throw new JobValidationException("parameters must be an object for job type " + type.wireName());
        }
        try {
            return objectMapper.treeToValue(node, type.parametersType());
        } catch (JsonProcessingException e) {
            throw new JobValidationException("parameters do not match job type " + type.wireName()
                    + ": " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("parameters do not match job type " + type.wireName()
                    + ": " + e.getMessage());
        }
    }
}
