package com.socialintel.collector.client;

import java.util.Set;

/**
 * Maps raw failure signals of the external API onto the gateway's error taxonomy.
 *
 * <p>The API reports most errors with HTTP 200 and an {@code error} object carrying a numeric code;
 * transport-level failures arrive as HTTP statuses or I/O exceptions.
 */
public final class ApiErrorClassifier {

    /** Too many requests per second (6), flood control (9), rate limit reached (29). */
    static final Set<Integer> RATE_LIMIT_CODES = Set.of(6, 9, 29);

    /** Unknown error (1), internal server error (10). */
    static final Set<Integer> TRANSIENT_CODES = Set.of(1, 10);

    /** User authorization failed: token expired or revoked. */
    static final int AUTH_FAILED_CODE = 5;

    private ApiErrorClassifier() {}

    public static ApiException fromApiError(String method, int errorCode, String errorMessage) {
        String message = "API error " + errorCode + " on " + method + ": " + errorMessage;
        if (RATE_LIMIT_CODES.contains(errorCode)) {
            return new RateLimitException(method, errorCode, message);
        }
        if (TRANSIENT_CODES.contains(errorCode)) {
            return new TransientNetworkException(method, errorCode, message);
        }
        if (errorCode == AUTH_FAILED_CODE) {
            return new AuthExpiredException(method, errorCode, message);
        }
        return new FatalApiException(method, errorCode, message);
    }

    public static ApiException fromHttpStatus(String method, int status, String statusText) {
        String message = "HTTP " + status + " on " + method + (statusText == null ? "" : ": " + statusText);
        if (status == 429) {
            return new RateLimitException(method, status, message);
        }
        if (status == 401) {
            return new AuthExpiredException(method, status, message);
        }
        if (status >= 500 || status == 408) {
            return new TransientNetworkException(method, status, message);
        }
        return new FatalApiException(method, status, message);
    }

    public static ApiException fromIoFailure(String method, Exception cause) {
        return new TransientNetworkException(method, 0,
                "I/O failure on " + method + ": " + cause.getMessage(), cause);
    }
}
