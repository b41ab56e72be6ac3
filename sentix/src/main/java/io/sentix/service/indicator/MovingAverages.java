package io.sentix.service.indicator;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple and exponential moving averages over a price series (oldest first).
 *
 * Both return an empty list when the series is shorter than the period.
 */
public final class MovingAverages {

    private MovingAverages() {
    }

    /**
     * Sliding mean. Element i of the result is the mean of values[i .. i + period - 1].
     */
    public static List<Double> sma(List<Double> values, int period) {
        requirePositive(period);
        List<Double> result = new ArrayList<>();
        if (values.size() < period) {
            return result;
        }

        double sum = 0;
        for (int i = 0; i < period; i++) {
            sum += values.get(i);
        }
        result.add(sum / period);

        for (int i = period; i < values.size(); i++) {
            sum += values.get(i) - values.get(i - period);
            result.add(sum / period);
        }
        return result;
    }

    /**
     * EMA seeded with the SMA of the first period values.
     *
     * ema[i] = value[i] × k + ema[i-1] × (1 - k), k = 2 / (period + 1)
     *
     * A single-element input returns that element whatever the period.
     */
    public static List<Double> ema(List<Double> values, int period) {
        requirePositive(period);
        List<Double> result = new ArrayList<>();
        if (values.size() == 1) {
            result.add(values.get(0));
            return result;
        }
        if (values.size() < period) {
            return result;
        }

        double k = 2.0 / (period + 1);
        double seed = 0;
        for (int i = 0; i < period; i++) {
            seed += values.get(i);
        }
        double ema = seed / period;
        result.add(ema);

        for (int i = period; i < values.size(); i++) {
            ema = values.get(i) * k + ema * (1 - k);
            result.add(ema);
        }
        return result;
    }

    /**
     * Last EMA value, 0 when the series is too short.
     */
    public static double lastEma(List<Double> values, int period) {
        List<Double> ema = ema(values, period);
        return ema.isEmpty() ? 0 : ema.get(ema.size() - 1);
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Population standard deviation around the given mean.
     */
    public static double populationStdDev(List<Double> values, double mean) {
        if (values.isEmpty()) {
            return 0;
        }
        double variance = 0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        return Math.sqrt(variance / values.size());
    }

    private static void requirePositive(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
    }
}
