package io.sentix.domain.indicator;

/**
 * Classic pivot levels.
 *
 * pivot      = (H + L + C) / 3
 * support    = 2 × pivot - H
 * resistance = 2 × pivot - L
 */
public record SupportResistance(
    double support,
    double resistance,
    double pivot,
    boolean sufficient
) {
    /**
     * ±5% band around the price when there are too few candles for a pivot.
     */
    public static SupportResistance insufficient(double price) {
        return new SupportResistance(price * 0.95, price * 1.05, price, false);
    }
}
