package io.sentix.domain.indicator;

/**
 * Price / RSI divergence. Strength is the absolute RSI difference between the
 * two compared extrema.
 */
public record Divergence(DivergenceType type, double strength) {

    public static Divergence none() {
        return new Divergence(DivergenceType.NONE, 0);
    }

    public static Divergence bullish(double strength) {
        return new Divergence(DivergenceType.BULLISH, strength);
    }

    public static Divergence bearish(double strength) {
        return new Divergence(DivergenceType.BEARISH, strength);
    }

    public enum DivergenceType {
        BULLISH,
        BEARISH,
        NONE
    }
}
