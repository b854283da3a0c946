package com.socialintel.collector.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.socialintel.collector.client.CallCancelledException;
import com.socialintel.collector.client.CredentialRenewalException;
import com.socialintel.collector.client.FatalApiException;
import com.socialintel.collector.model.Phase;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies per-item failure isolation, systemic abort and cancellation of a phase fan-out.
 */
class PhaseTaskGroupTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final CancellationToken token = CancellationToken.none(Clock.systemUTC());
    private final List<String> failedItems = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PhaseTaskGroup newGroup() {
        return new PhaseTaskGroup(Phase.POSTS, executor, token, (item, e) -> failedItems.add(item));
    }

    @Test
    void join_reportsApiFailuresAndKeepsGoing() throws Exception {
        PhaseTaskGroup group = newGroup();
        AtomicInteger done = new AtomicInteger();

        group.fork("a", done::incrementAndGet);
        group.fork("b", () -> {
            throw new FatalApiException("wall.get", 15, "Access denied");
        });
        group.fork("c", done::incrementAndGet);
        PhaseTaskGroup.Outcome outcome = group.join();

        assertEquals(3, outcome.attempted());
        assertEquals(1, outcome.failed());
        assertNull(outcome.systemicFailure());
        assertEquals(2, done.get());
        assertEquals(List.of("b"), failedItems);
        assertEquals(1.0 / 3, outcome.failureRate(), 1e-9);
    }

    @Test
    void join_stopsStartingItemsAfterSystemicFailure() throws Exception {
        PhaseTaskGroup group = newGroup();
        AtomicInteger done = new AtomicInteger();

        group.fork("a", () -> {
            throw new CredentialRenewalException("renewal failed");
        });
        group.fork("b", done::incrementAndGet);
        PhaseTaskGroup.Outcome outcome = group.join();

        assertInstanceOf(CredentialRenewalException.class, outcome.systemicFailure());
        assertEquals(1, outcome.skipped());
        assertEquals(0, done.get());
        assertTrue(failedItems.isEmpty());
    }

    @Test
    void join_countsCallHeldBackByStopAsSkippedNotFailed() throws Exception {
        PhaseTaskGroup group = newGroup();

        group.fork("a", () -> {
            token.cancel("cancelled by request");
            throw new CallCancelledException("wall.get");
        });
        PhaseTaskGroup.Outcome outcome = group.join();

        assertEquals(0, outcome.attempted());
        assertEquals(0, outcome.failed());
        assertEquals(1, outcome.skipped());
        assertNull(outcome.systemicFailure());
        assertTrue(failedItems.isEmpty());
    }

    @Test
    void join_skipsItemsNotStartedBeforeCancellation() throws Exception {
        PhaseTaskGroup group = newGroup();
        AtomicInteger done = new AtomicInteger();

        group.fork("a", () -> {
            done.incrementAndGet();
            token.cancel("user request");
        });
        group.fork("b", done::incrementAndGet);
        group.fork("c", done::incrementAndGet);
        PhaseTaskGroup.Outcome outcome = group.join();

        assertEquals(1, done.get());
        assertEquals(1, outcome.attempted());
        assertEquals(2, outcome.skipped());
        assertTrue(group.isStopping());
    }
}
