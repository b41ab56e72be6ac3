package io.sentix.infrastructure.provider;

/**
 * Normalized failure categories for external data providers.
 */
public enum ProviderErrorType {
    RATE_LIMIT(true),
    TIMEOUT(true),
    SERVER_ERROR(true),
    CLIENT_ERROR(false),
    NETWORK_ERROR(true),
    INVALID_RESPONSE(false),
    AUTH_ERROR(false),
    UNKNOWN(false);

    private final boolean retryable;

    ProviderErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Classify an HTTP status. 429 → RATE_LIMIT, 401/403 → AUTH_ERROR,
     * 5xx → SERVER_ERROR, other 4xx → CLIENT_ERROR.
     */
    public static ProviderErrorType fromHttpStatus(int status) {
        if (status == 429) return RATE_LIMIT;
        if (status == 401 || status == 403) return AUTH_ERROR;
        if (status >= 500) return SERVER_ERROR;
        if (status >= 400) return CLIENT_ERROR;
        return UNKNOWN;
    }
}
