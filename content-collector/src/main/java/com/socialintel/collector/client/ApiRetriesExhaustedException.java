package com.socialintel.collector.client;

import lombok.Getter;

/**
 * A retryable failure persisted through every allowed attempt.
 */
@Getter
public class ApiRetriesExhaustedException extends ApiException {

    private final int attempts;

    public ApiRetriesExhaustedException(String method, int attempts, RetryableApiException lastFailure) {
        super(method, lastFailure.getCode(),
                method + " failed after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }
}
