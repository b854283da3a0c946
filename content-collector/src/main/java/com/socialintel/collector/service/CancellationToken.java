package com.socialintel.collector.service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop signal for one job. Checked before each item and each page request; calls already
 * in flight are left to finish. An optional deadline cancels the job once passed.
 */
public class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Instant deadline;
    private final Clock clock;

    public CancellationToken(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static CancellationToken none(Clock clock) {
        return new CancellationToken(clock, null);
    }

    /** @return true if this call cancelled the token, false if it already was */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        if (reason.get() != null) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            reason.compareAndSet(null, "deadline " + deadline + " exceeded");
            return true;
        }
        return false;
    }

    public String reason() {
        return reason.get();
    }
}
