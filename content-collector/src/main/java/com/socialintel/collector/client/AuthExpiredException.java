package com.socialintel.collector.client;

/**
 * The access token was rejected. The gateway renews once and repeats the call once.
 */
public class AuthExpiredException extends ApiException {

    public AuthExpiredException(String method, int code, String message) {
        super(method, code, message);
    }
}
