package io.sentix.domain.indicator;

/**
 * ADX / DI reading. Values are rounded to one decimal.
 */
public record AdxReading(
    double adx,
    double plusDI,
    double minusDI,
    AdxTrend trend,
    boolean sufficient
) {
    public static AdxReading insufficient() {
        return new AdxReading(0, 0, 0, AdxTrend.NONE, false);
    }

    public enum AdxTrend {
        STRONG_UP,
        STRONG_DOWN,
        WEAK_UP,
        WEAK_DOWN,
        RANGING,
        NONE
    }
}
