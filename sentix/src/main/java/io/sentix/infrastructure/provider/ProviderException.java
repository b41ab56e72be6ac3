package io.sentix.infrastructure.provider;

/**
 * Exception thrown when an external data provider call fails.
 */
public class ProviderException extends RuntimeException {

    private final String provider;
    private final ProviderErrorType errorType;
    private final String endpoint;
    private final Integer statusCode;
    private final boolean retryable;

    public ProviderException(String provider, ProviderErrorType errorType, String endpoint,
                             Integer statusCode, String message) {
        this(provider, errorType, endpoint, statusCode, message, null);
    }

    public ProviderException(String provider, ProviderErrorType errorType, String endpoint,
                             Integer statusCode, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", provider, errorType, message), cause);
        this.provider = provider;
        this.errorType = errorType;
        this.endpoint = endpoint;
        this.statusCode = statusCode;
        this.retryable = errorType.isRetryable();
    }

    public String getProvider() {
        return provider;
    }

    public ProviderErrorType getErrorType() {
        return errorType;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * HTTP status, or null when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
