package com.socialintel.collector.client;

import com.socialintel.collector.model.AccessToken;

/**
 * Issues fresh access tokens. Called only through {@link AccessTokenProvider}, which guarantees a
 * single concurrent renewal per user.
 */
public interface TokenSource {

    /**
     * @throws CredentialRenewalException if no token can be issued
     */
    AccessToken issue(String userId);
}
