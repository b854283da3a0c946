package com.socialintel.collector.client;

public class RateLimitException extends RetryableApiException {

    public RateLimitException(String method, int code, String message) {
        super(method, code, message, null);
    }
}
