package com.socialintel.collector.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies burst, sustained rate and the rolling-window bound of the shared limiter against a mock clock.
 */
class TokenBucketRateLimiterTest {

    private static final long SECOND = TimeUnit.SECONDS.toNanos(1);

    private final AtomicLong now = new AtomicLong();
    private final List<Long> sleeps = new ArrayList<>();

    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new TokenBucketRateLimiter(3, Duration.ofSeconds(1), now::get, nanos -> {
            sleeps.add(nanos);
            now.addAndGet(nanos);
        });
    }

    @Test
    void acquire_allowsBurstUpToCapacityWithoutWaiting() {
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        assertTrue(sleeps.isEmpty());
        assertEquals(0, limiter.availableTokens());
    }

    @Test
    void acquire_waitsUntilOldestTokenReturns() {
        limiter.acquire();
        now.addAndGet(SECOND / 4);
        limiter.acquire();
        limiter.acquire();

        limiter.acquire();

        assertEquals(List.of(SECOND - SECOND / 4), sleeps);
        assertEquals(SECOND, now.get());
    }

    @Test
    void acquire_neverExceedsCapacityInAnyRollingWindow() {
        List<Long> dispatched = new ArrayList<>();
        long[] gaps = {0, 10, 400, 0, 0, 900, 50, 0, 300, 0, 0, 0, 700, 20, 0, 0, 0, 999, 1, 0};
        for (long gapMillis : gaps) {
            now.addAndGet(TimeUnit.MILLISECONDS.toNanos(gapMillis));
            limiter.acquire();
            dispatched.add(now.get());
        }

        for (int i = 0; i + 3 < dispatched.size(); i++) {
            long span = dispatched.get(i + 3) - dispatched.get(i);
            assertTrue(span >= SECOND, "calls " + i + ".." + (i + 3) + " fell within " + span + "ns");
        }
    }

    @Test
    void acquire_sustainsConfiguredRateOverTime() {
        for (int i = 0; i < 30; i++) {
            limiter.acquire();
        }

        // 3 immediately, then 3 more each second
        assertEquals(9 * SECOND, now.get());
    }

    @Test
    void acquire_boundsConcurrentCallersToo() throws Exception {
        AtomicLong clock = new AtomicLong();
        TokenBucketRateLimiter shared = new TokenBucketRateLimiter(5, Duration.ofSeconds(1), clock::get,
                clock::addAndGet);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 5; i++) {
                        shared.acquire();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // 20 slots at 5 per second: the last batch cannot start before t = 3s
        assertEquals(3 * SECOND, clock.get());
    }

    @Test
    void acquire_restoresInterruptFlagWhenInterrupted() {
        TokenBucketRateLimiter interrupted = new TokenBucketRateLimiter(1, Duration.ofSeconds(1), now::get,
                nanos -> {
                    throw new InterruptedException("stop");
                });
        interrupted.acquire();

        assertThrows(IllegalStateException.class, interrupted::acquire);
        assertTrue(Thread.interrupted());
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class,
                () -> new TokenBucketRateLimiter(0, Duration.ofSeconds(1), now::get, nanos -> { }));
    }
}
