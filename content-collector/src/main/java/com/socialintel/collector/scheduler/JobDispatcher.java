package com.socialintel.collector.scheduler;

import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.output.OutputRouter;
import com.socialintel.collector.service.CancellationRegistry;
import com.socialintel.collector.service.CollectionWorker;
import com.socialintel.collector.service.JobService;
import com.socialintel.collector.store.JobQueue;
import com.socialintel.collector.store.JobRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Hands queued jobs to the worker pool.
 *
 * On startup the schemas are created and the queue is rebuilt from the job table. Afterwards a
 * fixed-delay tick moves job ids from the queue to free worker slots, highest priority first.
 */
@Component
@Slf4j
public class JobDispatcher {

    private final JobQueue jobQueue;
    private final JobRepository jobRepository;
    private final OutputRouter outputRouter;
    private final JobService jobService;
    private final CollectionWorker worker;
    private final CancellationRegistry cancellations;
    private final ExecutorService workerExecutor;
    private final Semaphore slots;

    public JobDispatcher(JobQueue jobQueue,
                         JobRepository jobRepository,
                         OutputRouter outputRouter,
                         JobService jobService,
                         CollectionWorker worker,
                         CancellationRegistry cancellations,
                         CollectorProperties properties,
                         @Qualifier("workerExecutor") ExecutorService workerExecutor) {
        this.jobQueue = jobQueue;
        this.jobRepository = jobRepository;
        this.outputRouter = outputRouter;
        this.jobService = jobService;
        this.worker = worker;
        this.cancellations = cancellations;
        this.workerExecutor = workerExecutor;
        this.slots = new Semaphore(properties.getWorker().getConcurrency());
    }

    /**
     * On application startup:
     *  1. Ensure the job and content schemas exist
     *  2. Re-queue PENDING jobs and fail jobs a previous process left PROCESSING
     */
    @PostConstruct
    public void onStartup() {
        jobRepository.ensureSchema();
        try {
            outputRouter.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise content schema (running in CSV-only mode?): {}", e.getMessage());
        }
        jobService.recoverOnStartup();
    }

    @Scheduled(fixedDelayString = "${collector.worker.poll-interval-ms:500}")
    public void dispatch() {
        while (slots.tryAcquire()) {
            Optional<String> next = jobQueue.poll();
            if (next.isEmpty()) {
                slots.release();
                return;
            }
            String jobId = next.get();
            try {
                workerExecutor.execute(() -> runJob(jobId));
            } catch (RejectedExecutionException e) {
                slots.release();
                log.warn("Worker pool rejected job {}; it stays PENDING until the next start", jobId);
                return;
            }
        }
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    @PreDestroy
    public void onShutdown() {
        log.info("Shutting down: cancelling running jobs");
        cancellations.cancelAll("service shutting down");
    }

    private void runJob(String jobId) {
        try {
            worker.process(jobId);
        } catch (Exception e) {
            log.error("Worker crashed on job {}: {}", jobId, e.getMessage(), e);
        } finally {
            slots.release();
        }
    }
}
