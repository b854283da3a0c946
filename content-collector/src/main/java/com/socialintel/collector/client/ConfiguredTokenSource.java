package com.socialintel.collector.client;

import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.model.AccessToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Hands out the service token from configuration ({@code VK_ACCESS_TOKEN}), stamped with the configured
 * lifetime from the moment it is issued.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfiguredTokenSource implements TokenSource {

    private final CollectorProperties properties;
    private final Clock clock;

    @Override
    public AccessToken issue(String userId) {
        CollectorProperties.Token config = properties.getToken();
        if (config.getAccessToken() == null || config.getAccessToken().isBlank()) {
            throw new CredentialRenewalException("No access token configured (collector.token.access-token)");
        }
        AccessToken token = new AccessToken(config.getAccessToken(), userId,
                clock.instant().plus(config.getLifetime()));
        log.info("Issued access token for user {} valid until {}", userId, token.expiresAt());
        return token;
    }
}
