package com.socialintel.collector.client;

/**
 * Failure that may succeed when repeated after a pause.
 */
public abstract class RetryableApiException extends ApiException {

    protected RetryableApiException(String method, int code, String message, Throwable cause) {
        super(method, code, message, cause);
    }
}
