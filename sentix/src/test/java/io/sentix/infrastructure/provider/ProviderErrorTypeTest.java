package io.sentix.infrastructure.provider;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProviderErrorType and ProviderException.
 */
class ProviderErrorTypeTest {

    @Test
    void testFromHttpStatus() {
        assertEquals(ProviderErrorType.RATE_LIMIT, ProviderErrorType.fromHttpStatus(429));
        assertEquals(ProviderErrorType.AUTH_ERROR, ProviderErrorType.fromHttpStatus(401));
        assertEquals(ProviderErrorType.AUTH_ERROR, ProviderErrorType.fromHttpStatus(403));
        assertEquals(ProviderErrorType.CLIENT_ERROR, ProviderErrorType.fromHttpStatus(400));
        assertEquals(ProviderErrorType.CLIENT_ERROR, ProviderErrorType.fromHttpStatus(418));
        assertEquals(ProviderErrorType.SERVER_ERROR, ProviderErrorType.fromHttpStatus(500));
        assertEquals(ProviderErrorType.SERVER_ERROR, ProviderErrorType.fromHttpStatus(503));
        assertEquals(ProviderErrorType.UNKNOWN, ProviderErrorType.fromHttpStatus(302));
    }

    @Test
    void testRetryableTypes() {
        assertTrue(ProviderErrorType.RATE_LIMIT.isRetryable());
        assertTrue(ProviderErrorType.TIMEOUT.isRetryable());
        assertTrue(ProviderErrorType.SERVER_ERROR.isRetryable());
        assertTrue(ProviderErrorType.NETWORK_ERROR.isRetryable());
        assertFalse(ProviderErrorType.CLIENT_ERROR.isRetryable());
        assertFalse(ProviderErrorType.INVALID_RESPONSE.isRetryable());
        assertFalse(ProviderErrorType.AUTH_ERROR.isRetryable());
        assertFalse(ProviderErrorType.UNKNOWN.isRetryable());
    }

    @Test
    void testExceptionCarriesContext() {
        RuntimeException cause = new RuntimeException("io");
        ProviderException e = new ProviderException("Binance", ProviderErrorType.SERVER_ERROR,
            "/api/v3/klines", 503, "HTTP error 503", cause);

        assertEquals("[Binance:SERVER_ERROR] HTTP error 503", e.getMessage());
        assertEquals("Binance", e.getProvider());
        assertEquals("/api/v3/klines", e.getEndpoint());
        assertEquals(503, e.getStatusCode());
        assertTrue(e.isRetryable());
        assertSame(cause, e.getCause());

        ProviderException noResponse = new ProviderException("Binance", ProviderErrorType.CLIENT_ERROR,
            "/api/v3/klines", null, "unknown asset");
        assertNull(noResponse.getStatusCode());
        assertFalse(noResponse.isRetryable());
    }
}
