package io.sentix.service.indicator;

import io.sentix.domain.data.Candle;

import java.util.List;

/**
 * ATR Calculator - Average True Range from candle data.
 *
 * Usage:
 * 1. Volatility context on the signal snapshot (ATR and ATR % of price)
 * 2. Feature store (atr14)
 *
 * Calculation Method:
 * - Simple mean of the trailing period true ranges
 * - True Range: TR = max(H-L, |H-PC|, |L-PC|)
 */
public final class ATRCalculator {

    public static final int DEFAULT_PERIOD = 14;

    private ATRCalculator() {
    }

    /**
     * Calculate ATR over the most recent period true ranges.
     *
     * Requires at least (period + 1) candles: period ranges plus the previous
     * close of the first one.
     *
     * @param candles Candles in chronological order (oldest first)
     * @param period  ATR period (typically 14)
     * @return ATR value, or 0 if insufficient data
     */
    public static double calculate(List<Candle> candles, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("ATR period must be positive: " + period);
        }
        if (!hasSufficientData(candles, period)) {
            return 0;
        }

        double sumTR = 0;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            sumTR += calculateTrueRange(candles.get(i), candles.get(i - 1));
        }
        return sumTR / period;
    }

    public static double calculate(List<Candle> candles) {
        return calculate(candles, DEFAULT_PERIOD);
    }

    /**
     * Calculate True Range for a candle.
     *
     * TR = max(H - L, |H - PC|, |L - PC|)
     *
     * @param current  Current candle
     * @param previous Previous candle
     * @return True Range value
     */
    public static double calculateTrueRange(Candle current, Candle previous) {
        if (current == null || previous == null) {
            throw new IllegalArgumentException("Candles cannot be null");
        }
        return current.trueRange(previous);
    }

    /**
     * ATR as a percentage of price, 0 when price is not positive.
     */
    public static double percentOf(double atr, double price) {
        return price > 0 ? atr / price * 100 : 0;
    }

    /**
     * Validate that candles are sufficient for ATR calculation.
     *
     * @param candles Candle list
     * @param period  ATR period
     * @return True if sufficient candles available
     */
    public static boolean hasSufficientData(List<Candle> candles, int period) {
        return candles != null && candles.size() >= period + 1;
    }
}
