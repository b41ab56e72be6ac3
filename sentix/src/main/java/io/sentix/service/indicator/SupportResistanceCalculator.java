package io.sentix.service.indicator;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleSeries;
import io.sentix.domain.indicator.SupportResistance;

import java.util.List;

/**
 * Classic pivot support / resistance over the trailing window.
 *
 * H is the highest high and L the lowest low of the window, C is the last close.
 */
public final class SupportResistanceCalculator {

    public static final int DEFAULT_WINDOW = 30;
    private static final int MIN_CANDLES = 3;

    private SupportResistanceCalculator() {
    }

    public static SupportResistance calculate(List<Candle> candles) {
        return calculate(candles, DEFAULT_WINDOW);
    }

    public static SupportResistance calculate(List<Candle> candles, int window) {
        List<Candle> recent = CandleSeries.tail(candles, window);
        if (recent.size() < MIN_CANDLES) {
            double price = recent.isEmpty() ? 0 : CandleSeries.last(recent).close();
            return SupportResistance.insufficient(price);
        }

        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (Candle candle : recent) {
            high = Math.max(high, candle.high());
            low = Math.min(low, candle.low());
        }
        double close = CandleSeries.last(recent).close();

        double pivot = (high + low + close) / 3;
        return new SupportResistance(2 * pivot - high, 2 * pivot - low, pivot, true);
    }
}
