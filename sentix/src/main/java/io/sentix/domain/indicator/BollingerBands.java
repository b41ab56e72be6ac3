package io.sentix.domain.indicator;

/**
 * Bollinger Bands reading.
 *
 * bandwidth = (upper - lower) / middle × 100
 * percentB  = (price - lower) / (upper - lower), 0.5 when the bands are collapsed
 */
public record BollingerBands(
    double upper,
    double middle,
    double lower,
    double bandwidth,
    double percentB,
    boolean sufficient
) {
    /**
     * Degenerate bands collapsed onto the last price.
     */
    public static BollingerBands insufficient(double lastPrice) {
        return new BollingerBands(lastPrice, lastPrice, lastPrice, 0, 0.5, false);
    }

    /**
     * Position of the price relative to the bands.
     */
    public String position() {
        if (percentB > 1) return "above";
        if (percentB < 0) return "below";
        return "within";
    }
}
