package io.sentix.service.pattern;

import io.sentix.domain.indicator.BollingerSqueeze;
import io.sentix.domain.indicator.BollingerSqueeze.SqueezeDirection;
import io.sentix.service.indicator.BollingerBandsCalculator;

import java.util.ArrayList;
import java.util.List;

/**
 * Bollinger squeeze: the current bandwidth is below 70% of the mean of the
 * last 20 bandwidths. The breakout hint compares the last close with the close
 * four candles earlier.
 */
public final class BBSqueezeDetector {

    public static final int DEFAULT_PERIOD = 20;

    private static final int HISTORY = 20;
    private static final double SQUEEZE_RATIO = 0.7;

    private BBSqueezeDetector() {
    }

    public static BollingerSqueeze detect(List<Double> prices) {
        return detect(prices, DEFAULT_PERIOD);
    }

    public static BollingerSqueeze detect(List<Double> prices, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Squeeze period must be positive: " + period);
        }
        if (prices.size() < period + HISTORY) {
            return BollingerSqueeze.insufficient();
        }

        List<Double> bandwidths = new ArrayList<>();
        for (int end = period; end <= prices.size(); end++) {
            List<Double> window = prices.subList(end - period, end);
            bandwidths.add(BollingerBandsCalculator.bandwidth(window, BollingerBandsCalculator.DEFAULT_STD_DEV));
        }

        double current = bandwidths.get(bandwidths.size() - 1);
        List<Double> recent = bandwidths.subList(bandwidths.size() - HISTORY, bandwidths.size());
        double sum = 0;
        for (double bw : recent) {
            sum += bw;
        }
        double average = sum / HISTORY;

        boolean squeeze = current < average * SQUEEZE_RATIO;

        double last = prices.get(prices.size() - 1);
        double fourBack = prices.get(prices.size() - 5);
        SqueezeDirection direction = last > fourBack ? SqueezeDirection.UP : SqueezeDirection.DOWN;

        return new BollingerSqueeze(squeeze, direction, current, average, true);
    }
}
