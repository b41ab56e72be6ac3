package io.sentix.infrastructure.provider;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Retry only on retryable provider failures
 * - Attempt limit
 * - Builder validation
 */
class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private RetryPolicy policy(int maxAttempts) {
        return RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(8))
            .multiplier(2.0)
            .maxAttempts(maxAttempts)
            .sleeper(sleeps::add)
            .build();
    }

    private static ProviderException failure(ProviderErrorType type) {
        return new ProviderException("Binance", type, "/api/v3/klines", null, type.name());
    }

    @Test
    void testExponentialBackoff() {
        RetryPolicy policy = policy(5);

        assertEquals(Duration.ofMillis(500), policy.delayAfterAttempt(1), "First delay should be initial delay");
        assertEquals(Duration.ofSeconds(1), policy.delayAfterAttempt(2));
        assertEquals(Duration.ofSeconds(2), policy.delayAfterAttempt(3));
        assertThrows(IllegalArgumentException.class, () -> policy.delayAfterAttempt(0));
    }

    @Test
    void testMaxDelayRespected() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(3.0)
            .build();

        assertEquals(Duration.ofSeconds(30), policy.delayAfterAttempt(2), "10 × 3 hits the cap");
        assertEquals(Duration.ofSeconds(30), policy.delayAfterAttempt(6));
    }

    @Test
    void testSuccessWithoutRetry() {
        assertEquals("ok", policy(3).execute("op", () -> "ok"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testRetriesUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy(3).execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw failure(ProviderErrorType.SERVER_ERROR);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        ProviderException thrown = assertThrows(ProviderException.class, () -> policy(3).execute("op", () -> {
            calls.incrementAndGet();
            throw failure(ProviderErrorType.TIMEOUT);
        }));

        assertEquals(ProviderErrorType.TIMEOUT, thrown.getErrorType());
        assertEquals(3, calls.get(), "First call plus two retries");
        assertEquals(2, sleeps.size());
    }

    @Test
    void testNonRetryableFailsFast() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ProviderException.class, () -> policy(3).execute("op", () -> {
            calls.incrementAndGet();
            throw failure(ProviderErrorType.INVALID_RESPONSE);
        }));
        assertEquals(1, calls.get());

        assertThrows(IllegalStateException.class, () -> policy(3).execute("op", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("not a provider failure");
        }));
        assertEquals(2, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testInterruptedSleepStopsRetrying() {
        RetryPolicy policy = RetryPolicy.builder()
            .sleeper(d -> {
                throw new InterruptedException("stop");
            })
            .build();

        try {
            ProviderException thrown = assertThrows(ProviderException.class,
                () -> policy.execute("op", () -> {
                    throw failure(ProviderErrorType.NETWORK_ERROR);
                }));
            assertEquals(ProviderErrorType.NETWORK_ERROR, thrown.getErrorType());
            assertTrue(Thread.currentThread().isInterrupted(), "Interrupt flag restored");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testMarketDataDefaults() {
        RetryPolicy policy = RetryPolicy.forMarketData();

        assertEquals(3, policy.getMaxAttempts());
        assertEquals(Duration.ofMillis(500), policy.delayAfterAttempt(1));
        assertEquals(Duration.ofSeconds(8), policy.delayAfterAttempt(10));
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxDelay(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().multiplier(1.0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () ->
            RetryPolicy.builder()
                .initialDelay(Duration.ofMinutes(10))
                .maxDelay(Duration.ofMinutes(5))
                .build()
        );
    }
}
