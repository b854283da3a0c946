package com.socialintel.collector.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Access token for the external API, owned by one user.
 */
public record AccessToken(String value, String userId, Instant expiresAt) {

    /** True when the token is expired or will be within {@code safetyMargin} of {@code now}. */
    public boolean isStale(Instant now, Duration safetyMargin) {
        return !now.plus(safetyMargin).isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "AccessToken[userId=" + userId + ", expiresAt=" + expiresAt + "]";
    }
}
