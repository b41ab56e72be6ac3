package io.sentix.infrastructure.binance;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window request limiter: at most maxRequests per window, counter reset
 * when the window has elapsed.
 */
public final class RequestRateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;

    private int requestCount = 0;
    private Instant windowEnd;

    public RequestRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
        this.windowEnd = clock.instant().plus(window);
    }

    /**
     * Take one slot. False when the current window is exhausted.
     */
    public synchronized boolean tryAcquire() {
        rollWindow();
        if (requestCount >= maxRequests) {
            return false;
        }
        requestCount++;
        return true;
    }

    public synchronized int remaining() {
        rollWindow();
        return Math.max(0, maxRequests - requestCount);
    }

    /**
     * Time until the current window resets (zero if already elapsed).
     */
    public synchronized Duration resetIn() {
        Duration left = Duration.between(clock.instant(), windowEnd);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private void rollWindow() {
        Instant now = clock.instant();
        if (!now.isBefore(windowEnd)) {
            requestCount = 0;
            windowEnd = now.plus(window);
        }
    }
}
