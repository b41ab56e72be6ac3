package io.sentix.domain.indicator;

import java.util.List;

/**
 * MACD reading: current MACD, signal and histogram plus the histogram series
 * (aligned to the signal line) and its momentum direction.
 */
public record MacdReading(
    double macd,
    double signal,
    double histogram,
    HistogramTrend histogramTrend,
    List<Double> histogramSeries,
    boolean sufficient
) {
    public MacdReading {
        histogramSeries = List.copyOf(histogramSeries);
    }

    /**
     * All-zero reading used when the series is shorter than the slow period.
     */
    public static MacdReading insufficient() {
        return new MacdReading(0, 0, 0, HistogramTrend.NEUTRAL, List.of(), false);
    }

    public enum HistogramTrend {
        GROWING,
        SHRINKING,
        NEUTRAL
    }
}
