package io.sentix.service.indicator;

import io.sentix.domain.indicator.MacdReading;
import io.sentix.domain.indicator.MacdReading.HistogramTrend;

import java.util.ArrayList;
import java.util.List;

/**
 * MACD (12, 26, 9).
 *
 * macdLine[i]  = EMA_fast[i + (slow - fast)] - EMA_slow[i]
 * signalLine   = EMA(macdLine, signal)
 * histogram[i] = macdLine[i + offset] - signalLine[i] (aligned to the signal line)
 */
public final class MACDCalculator {

    public static final int FAST_PERIOD = 12;
    public static final int SLOW_PERIOD = 26;
    public static final int SIGNAL_PERIOD = 9;

    private MACDCalculator() {
    }

    public static MacdReading calculate(List<Double> prices) {
        return calculate(prices, FAST_PERIOD, SLOW_PERIOD, SIGNAL_PERIOD);
    }

    public static MacdReading calculate(List<Double> prices, int fastPeriod, int slowPeriod, int signalPeriod) {
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException(
                "MACD fast period must be below slow period: " + fastPeriod + " >= " + slowPeriod);
        }
        if (prices.size() < slowPeriod) {
            return MacdReading.insufficient();
        }

        List<Double> fastEma = MovingAverages.ema(prices, fastPeriod);
        List<Double> slowEma = MovingAverages.ema(prices, slowPeriod);

        int offset = slowPeriod - fastPeriod;
        List<Double> macdLine = new ArrayList<>(slowEma.size());
        for (int i = 0; i < slowEma.size(); i++) {
            macdLine.add(fastEma.get(i + offset) - slowEma.get(i));
        }

        List<Double> signalLine = MovingAverages.ema(macdLine, signalPeriod);

        int signalOffset = macdLine.size() - signalLine.size();
        List<Double> histogramSeries = new ArrayList<>(signalLine.size());
        for (int i = 0; i < signalLine.size(); i++) {
            histogramSeries.add(macdLine.get(i + signalOffset) - signalLine.get(i));
        }

        double macd = macdLine.get(macdLine.size() - 1);
        double signal = signalLine.isEmpty() ? 0 : signalLine.get(signalLine.size() - 1);

        return new MacdReading(
            macd,
            signal,
            macd - signal,
            histogramTrend(histogramSeries),
            histogramSeries,
            true
        );
    }

    /**
     * Growing when the last sample exceeds the one two steps back (n-1 vs n-3).
     */
    static HistogramTrend histogramTrend(List<Double> histogram) {
        int n = histogram.size();
        if (n < 3) {
            return HistogramTrend.NEUTRAL;
        }
        return histogram.get(n - 1) > histogram.get(n - 3) ? HistogramTrend.GROWING : HistogramTrend.SHRINKING;
    }
}
