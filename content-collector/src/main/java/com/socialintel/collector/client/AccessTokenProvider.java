package com.socialintel.collector.client;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.socialintel.collector.config.CollectorProperties;
import com.socialintel.collector.model.AccessToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Credential cache in front of a {@link TokenSource}.
 *
 * Each cached token lives until it comes within the safety margin of its expiry. Loading goes
 * through the cache's atomic per-key computation, so any number of concurrent callers that find
 * the entry missing or stale trigger exactly one renewal and all receive its result.
 */
@Component
@Slf4j
public class AccessTokenProvider {

    private final TokenSource tokenSource;
    private final Clock clock;
    private final Duration safetyMargin;
    private final String defaultUserId;
    private final Cache<String, AccessToken> tokens;

    @Autowired
    public AccessTokenProvider(TokenSource tokenSource, CollectorProperties properties, Clock clock) {
        this(tokenSource, clock, properties.getToken().getSafetyMargin(), properties.getToken().getUserId());
    }

    public AccessTokenProvider(TokenSource tokenSource, Clock clock, Duration safetyMargin, String defaultUserId) {
        this.tokenSource = tokenSource;
        this.clock = clock;
        this.safetyMargin = safetyMargin;
        this.defaultUserId = defaultUserId;
        this.tokens = Caffeine.newBuilder()
                .expireAfter(new UntilStale())
                .build();
    }

    /** Fresh token for the default user, renewing first if the cached one is within the safety margin. */
    public AccessToken current() {
        return current(defaultUserId);
    }

    public AccessToken current(String userId) {
        AccessToken token = load(userId);
        if (token.isStale(clock.instant(), safetyMargin)) {
            return renew(token);
        }
        return token;
    }

    /**
     * Replaces {@code rejected} with a newly issued token. If another caller already replaced it, the
     * token they obtained is returned instead of issuing a second one.
     *
     * @throws CredentialRenewalException if the source cannot issue a usable token
     */
    public AccessToken renew(AccessToken rejected) {
        tokens.asMap().remove(rejected.userId(), rejected);
        AccessToken renewed = load(rejected.userId());
        if (renewed.isStale(clock.instant(), safetyMargin)) {
            tokens.asMap().remove(renewed.userId(), renewed);
            throw new CredentialRenewalException("Renewed token for user " + renewed.userId()
                    + " expires at " + renewed.expiresAt() + ", inside the safety margin");
        }
        return renewed;
    }

    private AccessToken load(String userId) {
        try {
            return tokens.get(userId, id -> {
                log.info("Renewing access token for user {}", id);
                return tokenSource.issue(id);
            });
        } catch (CredentialRenewalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CredentialRenewalException("Token renewal failed for user " + userId + ": " + e.getMessage(), e);
        }
    }

    private final class UntilStale implements Expiry<String, AccessToken> {

        @Override
        public long expireAfterCreate(String key, AccessToken token, long currentTime) {
            Duration ttl = Duration.between(Instant.now(clock), token.expiresAt().minus(safetyMargin));
            return ttl.isNegative() ? 0 : ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, AccessToken token, long currentTime, long currentDuration) {
            return expireAfterCreate(key, token, currentTime);
        }

        @Override
        public long expireAfterRead(String key, AccessToken token, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
