package com.socialintel.collector.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tokens of the jobs currently owned by a worker, so a cancel request can reach a running job.
 */
@Component
@Slf4j
public class CancellationRegistry {

    private final Map<String, CancellationToken> active = new ConcurrentHashMap<>();

    public void register(String jobId, CancellationToken token) {
        active.put(jobId, token);
    }

    public Optional<CancellationToken> find(String jobId) {
        return Optional.ofNullable(active.get(jobId));
    }

    public void remove(String jobId) {
        active.remove(jobId);
    }

    public boolean cancel(String jobId, String reason) {
        CancellationToken token = active.get(jobId);
        if (token == null) {
            return false;
        }
        if (token.cancel(reason)) {
            log.info("Cancellation requested for job {}: {}", jobId, reason);
        }
        return true;
    }

    public void cancelAll(String reason) {
        active.forEach((jobId, token) -> cancel(jobId, reason));
    }
}
