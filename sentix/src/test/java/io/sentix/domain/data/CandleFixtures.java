package io.sentix.domain.data;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic candle series for indicator and classifier tests.
 *
 * Candles are hourly from a fixed start. Each candle opens at the previous
 * close; high / low sit 0.5% outside the body.
 */
public final class CandleFixtures {

    public static final long START_MILLIS = 1_700_000_000_000L;
    public static final long HOUR_MILLIS = 3_600_000L;

    private CandleFixtures() {
    }

    public static Candle candle(int index, double open, double close, double volume) {
        return Candle.of(
            START_MILLIS + index * HOUR_MILLIS,
            open,
            Math.max(open, close) * 1.005,
            Math.min(open, close) * 0.995,
            close,
            volume
        );
    }

    /**
     * close[i] = start × factor^i, constant volume.
     */
    public static List<Candle> geometric(int count, double start, double factor) {
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            closes.add(start * Math.pow(factor, i));
        }
        return fromCloses(closes, 1000);
    }

    public static List<Candle> flat(int count, double price) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(candle(i, price, price, 1000));
        }
        return candles;
    }

    public static List<Candle> fromCloses(List<Double> closes, double volume) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            double open = i == 0 ? closes.get(0) : closes.get(i - 1);
            candles.add(candle(i, open, closes.get(i), volume));
        }
        return candles;
    }

    public static List<Double> linear(int count, double start, double step) {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            prices.add(start + i * step);
        }
        return prices;
    }
}
