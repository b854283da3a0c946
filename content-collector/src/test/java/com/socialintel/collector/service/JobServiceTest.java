package com.socialintel.collector.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialintel.collector.model.FetchCommentsParameters;
import com.socialintel.collector.model.Job;
import com.socialintel.collector.model.JobStatus;
import com.socialintel.collector.model.JobStatusView;
import com.socialintel.collector.model.JobSubmission;
import com.socialintel.collector.model.JobType;
import com.socialintel.collector.model.Phase;
import com.socialintel.collector.store.JobQueue;
import com.socialintel.collector.store.JobRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Verifies submission, status, cancellation, requeue and startup recovery of jobs.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobQueue jobQueue;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final CancellationRegistry cancellations = new CancellationRegistry();

    private JobService jobService;

    @BeforeEach
    void setUp() {
        jobService = new JobService(jobRepository, jobQueue, new JobParametersValidator(),
                new ProgressCalculator(ProgressWeights.DEFAULT, 50, 15, 100), cancellations, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void submit_storesPendingJobAndQueuesItByPriority() throws Exception {
        JobSubmission submission = new JobSubmission("fetch_comments",
                objectMapper.readTree("{\"groupIds\": [1, 2], \"postsPerGroup\": 5}"), 7, "alice");

        Job job = jobService.submit(submission);

        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(JobType.FETCH_COMMENTS, job.getType());
        assertEquals(5, ((FetchCommentsParameters) job.getParameters()).postsPerGroup());
        verify(jobRepository).save(job);
        verify(jobQueue).enqueue(job.getId(), 7);
    }

    @Test
    void submit_rejectsUnknownType() throws Exception {
        JobSubmission submission = new JobSubmission("scrape_everything", objectMapper.readTree("{}"), null, null);

        assertThrows(JobValidationException.class, () -> jobService.submit(submission));
        verifyNoInteractions(jobRepository, jobQueue);
    }

    @Test
    void submit_rejectsParametersOfTheWrongShape() throws Exception {
        JobSubmission submission = new JobSubmission("fetch_comments",
                objectMapper.readTree("{\"groupIds\": \"all of them\"}"), null, null);

        JobValidationException e = assertThrows(JobValidationException.class, () -> jobService.submit(submission));
        assertTrue(e.getViolations().get(0).contains("fetch_comments"));
        verifyNoInteractions(jobRepository, jobQueue);
    }

    @Test
    void submit_nullGroupIdIsReportedByValidation() throws Exception {
        JobSubmission submission = new JobSubmission("fetch_comments",
                objectMapper.readTree("{\"groupIds\": [1, null]}"), null, null);

        JobValidationException e = assertThrows(JobValidationException.class, () -> jobService.submit(submission));
        assertEquals(List.of("groupIds contains an empty id"), e.getViolations());
        verifyNoInteractions(jobRepository, jobQueue);
    }

    @Test
    void submit_rejectsMissingParameters() {
        JobSubmission submission = new JobSubmission("process_groups", null, null, null);

        assertThrows(JobValidationException.class, () -> jobService.submit(submission));
    }

    @Test
    void status_unknownJobIsNotFound() {
        when(jobRepository.findById("missing")).thenReturn(Optional.empty());

        assertThrows(JobNotFoundException.class, () -> jobService.status("missing"));
    }

    @Test
    void status_reportsClampedPercentageAndWarnings() {
        Job job = runningJob();
        job.getCounters().setTotal(Phase.GROUPS, 2);
        job.getCounters().addProcessed(Phase.GROUPS, 3);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        JobStatusView view = jobService.status(job.getId());

        assertEquals(10, view.percentage());
        assertEquals(JobStatus.PROCESSING, view.status());
        assertEquals(1, view.warnings().size());
    }

    @Test
    void status_completedJobReportsFullProgress() {
        Job job = runningJob();
        job.getCounters().setTotal(Phase.COMMENTS, 1_000);
        job.transitionTo(JobStatus.COMPLETED, NOW);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        assertEquals(100, jobService.status(job.getId()).percentage());
    }

    @Test
    void cancel_signalsRunningJobThroughItsToken() {
        CancellationToken token = CancellationToken.none(Clock.systemUTC());
        cancellations.register("running", token);

        jobService.cancel("running");

        assertTrue(token.isCancelled());
        verifyNoInteractions(jobRepository);
    }

    @Test
    void cancel_queuedJobIsCancelledInStoreAndDequeued() {
        Job job = pendingJob();
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepository.compareAndSetStatus(job.getId(), JobStatus.PENDING, JobStatus.CANCELLED, NOW))
                .thenReturn(true);

        jobService.cancel(job.getId());

        verify(jobQueue).remove(job.getId());
    }

    @Test
    void cancel_finishedJobIsConflict() {
        Job job = runningJob();
        job.transitionTo(JobStatus.COMPLETED, NOW);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        assertThrows(IllegalStateException.class, () -> jobService.cancel(job.getId()));
        verify(jobRepository, never()).compareAndSetStatus(anyString(), any(), any(), any());
    }

    @Test
    void requeue_finishedJobCreatesNewPendingJob() {
        Job job = runningJob();
        job.transitionTo(JobStatus.FAILED, NOW);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        Job copy = jobService.requeue(job.getId());

        assertNotEquals(job.getId(), copy.getId());
        assertEquals(JobStatus.PENDING, copy.getStatus());
        verify(jobRepository).save(copy);
        verify(jobQueue).enqueue(copy.getId(), job.getPriority());
    }

    @Test
    void requeue_unfinishedJobIsConflict() {
        Job job = pendingJob();
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        assertThrows(IllegalStateException.class, () -> jobService.requeue(job.getId()));
        verifyNoInteractions(jobQueue);
    }

    @Test
    void recoverOnStartup_requeuesPendingAndFailsInterruptedJobs() {
        Job pending = pendingJob();
        Job interrupted = runningJob();
        when(jobRepository.findByStatus(JobStatus.PROCESSING)).thenReturn(List.of(interrupted));
        when(jobRepository.findByStatus(JobStatus.PENDING)).thenReturn(List.of(pending));

        jobService.recoverOnStartup();

        ArgumentCaptor<Job> saved = ArgumentCaptor.forClass(Job.class);
        verify(jobRepository).save(saved.capture());
        assertEquals(JobStatus.FAILED, saved.getValue().getStatus());
        assertEquals(JobService.INTERRUPTED_BY_RESTART, saved.getValue().getLastError());
        verify(jobQueue).enqueue(eq(pending.getId()), eq(pending.getPriority()));
    }

    private static Job pendingJob() {
        return Job.create(new FetchCommentsParameters(List.of(1L), null, null, null), 2, "bob", NOW);
    }

    private static Job runningJob() {
        Job job = pendingJob();
        job.transitionTo(JobStatus.PROCESSING, NOW);
        return job;
    }
}
