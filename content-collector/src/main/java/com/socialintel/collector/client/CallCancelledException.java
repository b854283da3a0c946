package com.socialintel.collector.client;

import lombok.Getter;

/**
 * Raised instead of sending a request once the calling job has been told to stop. Never retried.
 */
@Getter
public class CallCancelledException extends RuntimeException {

    private final String method;

    public CallCancelledException(String method) {
        super("Call to " + method + " not sent: job is stopping");
        this.method = method;
    }
}
