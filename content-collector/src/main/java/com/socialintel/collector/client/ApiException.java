package com.socialintel.collector.client;

import lombok.Getter;

/**
 * Failure of one external API call, already classified. Subclasses decide whether a retry can help.
 */
@Getter
public class ApiException extends RuntimeException {

    /** API method that failed, e.g. {@code wall.get}. */
    private final String method;

    /** API error code or HTTP status; 0 when the failure happened below HTTP. */
    private final int code;

    public ApiException(String method, int code, String message) {
        super(message);
        this.method = method;
        this.code = code;
    }

    public ApiException(String method, int code, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
        this.code = code;
    }
}
