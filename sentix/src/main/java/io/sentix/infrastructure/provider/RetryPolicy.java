package io.sentix.infrastructure.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retry policy with exponential backoff for provider calls.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum attempt limit (first call included)
 * - Maximum backoff duration (cap)
 * - Only retryable {@link ProviderException}s are retried
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(500))
 *     .maxDelay(Duration.ofSeconds(8))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .build();
 *
 * List&lt;Candle&gt; candles = policy.execute("klines BTCUSDT", () -> fetch());
 * </pre>
 *
 * Immutable, so one instance can be shared by concurrent fetches.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Sleeper sleeper;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
                        int maxAttempts, Sleeper sleeper) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
    }

    /**
     * Blocking pause between attempts. Swapped out in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * Delay after the given failed attempt (1-based), capped at maxDelay.
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1: " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    /**
     * Run the call, retrying retryable provider failures until maxAttempts is
     * reached. The last failure is rethrown.
     */
    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 1;
        while (true) {
            try {
                return call.get();
            } catch (ProviderException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                Duration delay = delayAfterAttempt(attempt);
                log.warn("[Retry] {} failed ({}), attempt {}/{}, retrying in {}ms",
                    operation, e.getErrorType(), attempt, maxAttempts, delay.toMillis());
                pause(delay, e);
                attempt++;
            }
        }
    }

    private void pause(Duration delay, ProviderException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for public market-data endpoints.
     */
    public static RetryPolicy forMarketData() {
        return builder()
            .initialDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(8))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(8);
        private double multiplier = 2.0;
        private int maxAttempts = 3;
        private Sleeper sleeper = d -> Thread.sleep(d.toMillis());

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts, sleeper);
        }
    }
}
