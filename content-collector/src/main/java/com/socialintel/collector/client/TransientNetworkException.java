package com.socialintel.collector.client;

/**
 * Timeouts, connection failures, 5xx responses and the API's own "internal error" codes.
 */
public class TransientNetworkException extends RetryableApiException {

    public TransientNetworkException(String method, int code, String message) {
        super(method, code, message, null);
    }

    public TransientNetworkException(String method, int code, String message, Throwable cause) {
        super(method, code, message, cause);
    }
}
