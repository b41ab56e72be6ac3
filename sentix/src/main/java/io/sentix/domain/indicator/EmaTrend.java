package io.sentix.domain.indicator;

/**
 * EMA trend reading with the three EMAs it was derived from.
 */
public record EmaTrend(
    TrendDirection direction,
    double strength,
    double ema9,
    double ema21,
    double ema50
) {
    public static EmaTrend unknown() {
        return new EmaTrend(TrendDirection.UNKNOWN, 0, 0, 0, 0);
    }

    public boolean sufficient() {
        return direction != TrendDirection.UNKNOWN;
    }
}
