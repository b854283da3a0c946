package com.socialintel.collector.client;

/**
 * No usable access token could be obtained. Without a credential no call can succeed, so this is
 * systemic: the running job fails rather than recording a per-item error.
 */
public class CredentialRenewalException extends RuntimeException {

    public CredentialRenewalException(String message) {
        super(message);
    }

    public CredentialRenewalException(String message, Throwable cause) {
        super(message, cause);
    }
}
