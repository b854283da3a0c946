package com.socialintel.collector.client;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket holding {@code capacity} tokens, where a spent token returns to the bucket exactly one
 * period after it was spent.
 *
 * That gives the usual burst of {@code capacity} and a sustained rate of {@code capacity} per period,
 * and no more than {@code capacity} slots are handed out in any rolling window of one period.
 *
 * Callers are admitted in arrival order: waiters queue on a fair lock and the head of the queue
 * sleeps until the oldest token comes back.
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    /** Monotonic time source in nanoseconds. */
    @FunctionalInterface
    public interface Ticker {
        long read();
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }

    private final int capacity;
    private final long periodNanos;
    private final Ticker ticker;
    private final Sleeper sleeper;

    private final ReentrantLock admission = new ReentrantLock(true);
    /** Ring buffer of the times at which currently outstanding tokens were spent. */
    private final long[] spentAt;
    private int head;
    private int outstanding;

    public TokenBucketRateLimiter(int requestsPerSecond) {
        this(requestsPerSecond, Duration.ofSeconds(1), System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    public TokenBucketRateLimiter(int capacity, Duration period, Ticker ticker, Sleeper sleeper) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive, was " + period);
        }
        this.capacity = capacity;
        this.periodNanos = period.toNanos();
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.spentAt = new long[capacity];
    }

    @Override
    public void acquire() {
        try {
            admission.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a rate limiter slot", e);
        }
        try {
            while (true) {
                long now = ticker.read();
                returnTokens(now);
                if (outstanding < capacity) {
                    spend(now);
                    return;
                }
                long waitNanos = spentAt[head] + periodNanos - now;
                log.trace("Rate limiter full, waiting {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
                sleeper.sleep(waitNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a rate limiter slot", e);
        } finally {
            admission.unlock();
        }
    }

    /** Tokens that could be taken right now without waiting. */
    public int availableTokens() {
        admission.lock();
        try {
            returnTokens(ticker.read());
            return capacity - outstanding;
        } finally {
            admission.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private void returnTokens(long now) {
        while (outstanding > 0 && now - spentAt[head] >= periodNanos) {
            head = (head + 1) % capacity;
            outstanding--;
        }
    }

    private void spend(long now) {
        spentAt[(head + outstanding) % capacity] = now;
        outstanding++;
    }
}
