package io.sentix.service.indicator;

import io.sentix.domain.indicator.BollingerBands;

import java.util.List;

/**
 * Bollinger Bands (20, 2) using the population standard deviation of the
 * trailing window.
 */
public final class BollingerBandsCalculator {

    public static final int DEFAULT_PERIOD = 20;
    public static final double DEFAULT_STD_DEV = 2.0;

    private BollingerBandsCalculator() {
    }

    public static BollingerBands calculate(List<Double> prices) {
        return calculate(prices, DEFAULT_PERIOD, DEFAULT_STD_DEV);
    }

    public static BollingerBands calculate(List<Double> prices, int period, double stdDevMultiplier) {
        if (period <= 0) {
            throw new IllegalArgumentException("Bollinger period must be positive: " + period);
        }
        if (prices.size() < period) {
            double last = prices.isEmpty() ? 0 : prices.get(prices.size() - 1);
            return BollingerBands.insufficient(last);
        }

        List<Double> window = prices.subList(prices.size() - period, prices.size());
        double middle = MovingAverages.mean(window);
        double stdDev = MovingAverages.populationStdDev(window, middle);

        double upper = middle + stdDevMultiplier * stdDev;
        double lower = middle - stdDevMultiplier * stdDev;
        double width = upper - lower;
        double bandwidth = middle != 0 ? width / middle * 100 : 0;

        double price = prices.get(prices.size() - 1);
        double percentB = width > 0 ? (price - lower) / width : 0.5;

        return new BollingerBands(upper, middle, lower, bandwidth, percentB, true);
    }

    /**
     * Bandwidth of one window, 0 when its mean is 0.
     */
    public static double bandwidth(List<Double> window, double stdDevMultiplier) {
        double middle = MovingAverages.mean(window);
        if (middle == 0) {
            return 0;
        }
        double stdDev = MovingAverages.populationStdDev(window, middle);
        return 2 * stdDevMultiplier * stdDev / middle * 100;
    }
}
