package io.sentix.service.indicator;

import io.sentix.domain.indicator.RsiReading;

import java.util.ArrayList;
import java.util.List;

/**
 * Relative Strength Index with Wilder smoothing.
 *
 * avgGain / avgLoss are seeded with the mean of the first period deltas, then
 * avg_t = (avg_{t-1} × (n-1) + x_t) / n for every further delta.
 *
 * RSI = 100 when avgLoss == 0, else 100 - 100 / (1 + avgGain / avgLoss).
 */
public final class RSICalculator {

    public static final int DEFAULT_PERIOD = 14;

    private RSICalculator() {
    }

    public static RsiReading calculate(List<Double> prices) {
        return calculate(prices, DEFAULT_PERIOD);
    }

    /**
     * Current RSI. Neutral 50 tagged insufficient when fewer than period + 1 prices.
     */
    public static RsiReading calculate(List<Double> prices, int period) {
        List<Double> series = series(prices, period);
        if (series.isEmpty()) {
            return RsiReading.insufficient();
        }
        return RsiReading.of(series.get(series.size() - 1));
    }

    public static List<Double> series(List<Double> prices) {
        return series(prices, DEFAULT_PERIOD);
    }

    /**
     * RSI trail: the seed value, then one value per further delta.
     * Empty when fewer than period + 1 prices.
     */
    public static List<Double> series(List<Double> prices, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("RSI period must be positive: " + period);
        }
        List<Double> result = new ArrayList<>();
        if (prices.size() < period + 1) {
            return result;
        }

        int deltas = prices.size() - 1;
        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = prices.get(i) - prices.get(i - 1);
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss -= change;
            }
        }
        avgGain /= period;
        avgLoss /= period;
        result.add(rsi(avgGain, avgLoss));

        for (int i = period + 1; i <= deltas; i++) {
            double change = prices.get(i) - prices.get(i - 1);
            double gain = change > 0 ? change : 0;
            double loss = change < 0 ? -change : 0;
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
            result.add(rsi(avgGain, avgLoss));
        }
        return result;
    }

    private static double rsi(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return 100;
        }
        double rs = avgGain / avgLoss;
        return 100 - (100 / (1 + rs));
    }
}
