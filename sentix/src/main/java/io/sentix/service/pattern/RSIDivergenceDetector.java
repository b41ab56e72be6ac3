package io.sentix.service.pattern;

import io.sentix.domain.indicator.Divergence;

import java.util.ArrayList;
import java.util.List;

/**
 * Price / RSI divergence over the trailing lookback window.
 *
 * A local low is strictly below its two neighbours on each side (a local high
 * strictly above). Bullish: the last two lows make a lower price low and a
 * higher RSI low. Bearish: the last two highs make a higher price high and a
 * lower RSI high. Bullish is checked first; at most one divergence is reported.
 */
public final class RSIDivergenceDetector {

    public static final int DEFAULT_LOOKBACK = 20;
    private static final int RSI_WARMUP = 14;

    private RSIDivergenceDetector() {
    }

    public static Divergence detect(List<Double> prices, List<Double> rsiSeries) {
        return detect(prices, rsiSeries, DEFAULT_LOOKBACK);
    }

    public static Divergence detect(List<Double> prices, List<Double> rsiSeries, int lookback) {
        if (prices.size() < lookback + RSI_WARMUP || rsiSeries.size() < lookback) {
            return Divergence.none();
        }

        List<Double> priceWindow = prices.subList(prices.size() - lookback, prices.size());
        List<Double> rsiWindow = rsiSeries.subList(rsiSeries.size() - lookback, rsiSeries.size());

        List<Integer> lows = new ArrayList<>();
        List<Integer> highs = new ArrayList<>();
        for (int i = 2; i < lookback - 2; i++) {
            if (isLocalLow(priceWindow, i)) {
                lows.add(i);
            }
            if (isLocalHigh(priceWindow, i)) {
                highs.add(i);
            }
        }

        if (lows.size() >= 2) {
            int prev = lows.get(lows.size() - 2);
            int curr = lows.get(lows.size() - 1);
            if (priceWindow.get(curr) < priceWindow.get(prev) && rsiWindow.get(curr) > rsiWindow.get(prev)) {
                return Divergence.bullish(Math.abs(rsiWindow.get(curr) - rsiWindow.get(prev)));
            }
        }

        if (highs.size() >= 2) {
            int prev = highs.get(highs.size() - 2);
            int curr = highs.get(highs.size() - 1);
            if (priceWindow.get(curr) > priceWindow.get(prev) && rsiWindow.get(curr) < rsiWindow.get(prev)) {
                return Divergence.bearish(Math.abs(rsiWindow.get(prev) - rsiWindow.get(curr)));
            }
        }

        return Divergence.none();
    }

    private static boolean isLocalLow(List<Double> w, int i) {
        double p = w.get(i);
        return p < w.get(i - 1) && p < w.get(i - 2) && p < w.get(i + 1) && p < w.get(i + 2);
    }

    private static boolean isLocalHigh(List<Double> w, int i) {
        double p = w.get(i);
        return p > w.get(i - 1) && p > w.get(i - 2) && p > w.get(i + 1) && p > w.get(i + 2);
    }
}
