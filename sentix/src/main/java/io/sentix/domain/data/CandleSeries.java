package io.sentix.domain.data;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers over an ordered candle list (oldest first).
 */
public final class CandleSeries {

    private CandleSeries() {
    }

    public static List<Double> closes(List<Candle> candles) {
        List<Double> closes = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            closes.add(candle.close());
        }
        return closes;
    }

    /**
     * Trailing count candles (all of them when the list is shorter).
     */
    public static List<Candle> tail(List<Candle> candles, int count) {
        if (count >= candles.size()) {
            return candles;
        }
        return candles.subList(candles.size() - count, candles.size());
    }

    public static Candle last(List<Candle> candles) {
        if (candles.isEmpty()) {
            throw new IllegalArgumentException("Candle series is empty");
        }
        return candles.get(candles.size() - 1);
    }
}
