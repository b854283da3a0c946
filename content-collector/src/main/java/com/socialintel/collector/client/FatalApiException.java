package com.socialintel.collector.client;

/**
 * Bad request or a permanently unreachable target (deleted, private, access denied). Never retried.
 */
public class FatalApiException extends ApiException {

    public FatalApiException(String method, int code, String message) {
        super(method, code, message);
    }

    public FatalApiException(String method, int code, String message, Throwable cause) {
        super(method, code, message, cause);
    }
}
