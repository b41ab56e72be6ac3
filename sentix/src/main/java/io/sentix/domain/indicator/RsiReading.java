package io.sentix.domain.indicator;

/**
 * RSI value (0-100).
 *
 * When there is not enough history the reading is the neutral 50 tagged
 * as insufficient.
 */
public record RsiReading(double value, boolean sufficient) {

    public static final double NEUTRAL = 50.0;

    public static RsiReading of(double value) {
        return new RsiReading(value, true);
    }

    public static RsiReading insufficient() {
        return new RsiReading(NEUTRAL, false);
    }
}
