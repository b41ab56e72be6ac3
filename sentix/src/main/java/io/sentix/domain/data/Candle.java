package io.sentix.domain.data;

import java.time.Instant;

/**
 * OHLCV candle.
 *
 * Invariant: low ≤ {open, close} ≤ high, volume ≥ 0 (checked on construction).
 * Series of candles are always ordered oldest first.
 */
public record Candle(
    Instant timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public Candle {
        if (timestamp == null) {
            throw new IllegalArgumentException("Candle timestamp cannot be null");
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Candle volume cannot be negative: " + volume);
        }
        if (low > Math.min(open, close) || high < Math.max(open, close)) {
            throw new IllegalArgumentException(String.format(
                "Candle range [%s, %s] does not contain open %s / close %s", low, high, open, close));
        }
    }

    /**
     * Up candle (close ≥ open). Flat candles count as up.
     */
    public boolean isUp() {
        return close >= open;
    }

    /**
     * Typical price (H + L + C) / 3.
     */
    public double typicalPrice() {
        return (high + low + close) / 3;
    }

    /**
     * True Range against the previous candle.
     *
     * TR = max(H - L, |H - PC|, |L - PC|)
     */
    public double trueRange(Candle previous) {
        if (previous == null) {
            throw new IllegalArgumentException("Previous candle cannot be null");
        }
        double prevClose = previous.close();
        return Math.max(high - low, Math.max(Math.abs(high - prevClose), Math.abs(low - prevClose)));
    }

    /**
     * Create candle from epoch millis (Binance kline open time).
     */
    public static Candle of(long epochMillis, double o, double h, double l, double c, double v) {
        return new Candle(Instant.ofEpochMilli(epochMillis), o, h, l, c, v);
    }

    /**
     * Synthetic candle from a single price point (close-only sources):
     * open = close = price, high / low = price ± 0.5%.
     */
    public static Candle fromPrice(long epochMillis, double price, double volume) {
        return new Candle(Instant.ofEpochMilli(epochMillis), price, price * 1.005, price * 0.995, price, volume);
    }
}
