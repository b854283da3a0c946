package com.socialintel.collector.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The persisted unit of work.
 *
 * Status changes only through {@link #transitionTo}; nothing leaves a terminal state. Counters are
 * shared with phase workers and mutated atomically, everything else is written by the owning worker.
 * Only the most recent {@value #MAX_ERRORS} item errors are kept; {@link #getErrorCount()} counts all.
 */
@Getter
public class Job {

    public static final int MAX_ERRORS = 100;

    private final String id;
    private final JobType type;
    private final JobParameters parameters;
    private final int priority;
    private final String owner;
    private final Instant createdAt;
    private final PhaseCounters counters;
    @Getter(AccessLevel.NONE)
    private final Deque<JobError> errors = new ArrayDeque<>();
    @Getter(AccessLevel.NONE)
    private long errorCount;

    private volatile JobStatus status;
    private volatile Phase currentPhase;
    private volatile JobResult result;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    private Job(String id, JobParameters parameters, int priority, String owner, Instant createdAt,
                JobStatus status, PhaseCounters counters) {
        this.id = Objects.requireNonNull(id, "id");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.type = parameters.type();
        this.priority = priority;
        this.owner = owner;
        this.createdAt = createdAt;
        this.status = status;
        this.counters = counters;
        this.currentPhase = Phase.GROUPS;
    }

    public static Job create(JobParameters parameters, int priority, String owner, Instant now) {
        return new Job(UUID.randomUUID().toString(), parameters, priority, owner, now,
                JobStatus.PENDING, new PhaseCounters());
    }

    /** Rebuilds a job from its stored form. */
    public static Job restore(String id, JobParameters parameters, int priority, String owner,
                              Instant createdAt, JobStatus status, Phase currentPhase, Metrics metrics,
                              List<JobError> errors, long errorCount, String lastError, JobResult result,
                              Instant startedAt, Instant finishedAt) {
        Job job = new Job(id, parameters, priority, owner, createdAt, status,
                PhaseCounters.from(metrics == null ? Metrics.EMPTY : metrics));
        if (errors != null) {
            errors.forEach(job::keepError);
        }
        job.errorCount = Math.max(errorCount, job.errors.size());
        job.currentPhase = currentPhase == null ? Phase.GROUPS : currentPhase;
        job.lastError = lastError;
        job.result = result;
        job.startedAt = startedAt;
        job.finishedAt = finishedAt;
        return job;
    }

    /**
     * Moves the job to {@code next}, stamping start/finish times.
     *
     * @throws IllegalStateException if the state machine does not allow the transition
     */
    public synchronized void transitionTo(JobStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        if (next == JobStatus.PROCESSING) {
            startedAt = now;
        }
        if (next.isTerminal()) {
            finishedAt = now;
        }
    }

    public void enterPhase(Phase phase) {
        this.currentPhase = phase;
    }

    public synchronized void recordError(Phase phase, String item, String message, Instant now) {
        keepError(new JobError(phase, item, message, now));
        errorCount++;
        lastError = message;
    }

    private void keepError(JobError error) {
        if (errors.size() == MAX_ERRORS) {
            errors.removeFirst();
        }
        errors.addLast(error);
    }

    /** Records a job-level error that is not tied to one item. */
    public void fail(String message) {
        lastError = message;
    }

    public void complete(JobResult result) {
        this.result = result;
    }

    public Metrics metrics() {
        return counters.snapshot();
    }

    /** The kept item errors, oldest first. */
    public synchronized List<JobError> getErrors() {
        return List.copyOf(errors);
    }

    /** Item errors recorded over the whole run, including those no longer kept. */
    public synchronized long getErrorCount() {
        return errorCount;
    }

    /** New PENDING job carrying the same request; used to re-run a job that already finished. */
    public Job copyForRequeue(Instant now) {
        if (!status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is " + status + "; only finished jobs can be requeued");
        }
        return create(parameters, priority, owner, now);
    }
}
