package com.socialintel.collector.service;

import com.socialintel.collector.client.ApiException;
import com.socialintel.collector.client.CallCancelledException;
import com.socialintel.collector.model.Phase;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * Fan-out/fan-in of the items of one phase.
 *
 * Items run on a shared bounded pool. An item that fails with an {@link ApiException} is reported to
 * the failure handler and the phase goes on. Any other exception is systemic: it is kept, and no
 * further items start. Items that have not started when the job is cancelled are skipped, as are items
 * whose next request was held back by the stop signal.
 */
@Slf4j
public class PhaseTaskGroup {

    private final Phase phase;
    private final ExecutorService executor;
    private final CancellationToken token;
    private final BiConsumer<String, ApiException> onItemFailure;

    private final List<Future<?>> futures = new ArrayList<>();
    private final AtomicInteger attempted = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicReference<RuntimeException> systemicFailure = new AtomicReference<>();

    public PhaseTaskGroup(Phase phase, ExecutorService executor, CancellationToken token,
                          BiConsumer<String, ApiException> onItemFailure) {
        this.phase = phase;
        this.executor = executor;
        this.token = token;
        this.onItemFailure = onItemFailure;
    }

    public void fork(String item, Runnable work) {
        futures.add(executor.submit(() -> runItem(item, work)));
    }

    /** True once the job is cancelled or a systemic failure occurred; loops inside items check this between calls. */
    public boolean isStopping() {
        return systemicFailure.get() != null || token.isCancelled();
    }

    /**
     * Waits for every forked item.
     *
     * @throws InterruptedException if the waiting thread is interrupted; items keep running
     */
    public Outcome join() throws InterruptedException {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                // runItem catches RuntimeException, so only Errors get here
                Throwable cause = e.getCause();
                if (cause instanceof Error error) {
                    throw error;
                }
                systemicFailure.compareAndSet(null, new IllegalStateException(cause));
            }
        }
        return new Outcome(phase, attempted.get(), failed.get(), skipped.get(), systemicFailure.get());
    }

    private void runItem(String item, Runnable work) {
        if (isStopping()) {
            skipped.incrementAndGet();
            return;
        }
        attempted.incrementAndGet();
        try {
            work.run();
        } catch (CallCancelledException e) {
            attempted.decrementAndGet();
            skipped.incrementAndGet();
            log.debug("{} phase: {} stopped before {}", phase.wireName(), item, e.getMethod());
        } catch (ApiException e) {
            failed.incrementAndGet();
            onItemFailure.accept(item, e);
        } catch (RuntimeException e) {
            log.error("Systemic failure in {} phase on {}: {}", phase.wireName(), item, e.getMessage(), e);
            systemicFailure.compareAndSet(null, e);
        }
    }

    /**
     * @param attempted        items that ran to an outcome
     * @param failed           items that ended with an API error
     * @param skipped          items not started, or cut short, because of cancellation or a systemic failure
     * @param systemicFailure  first non-API failure, or null
     */
    public record Outcome(Phase phase, int attempted, int failed, int skipped, RuntimeException systemicFailure) {

        public double failureRate() {
            return attempted == 0 ? 0 : (double) failed / attempted;
        }
    }
}
