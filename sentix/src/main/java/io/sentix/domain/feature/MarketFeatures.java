package io.sentix.domain.feature;

import io.sentix.domain.data.CandleInterval;

import java.time.Instant;

/**
 * Derived market features for one asset at one interval.
 *
 * Returns and volatilities are percentages. Return / volatility periods are
 * counted in candles (1, 4, 24, 168), which map to 1h / 4h / 24h / 7d on hourly
 * candles.
 */
public record MarketFeatures(
    // Last candle
    double price,
    double open,
    double high,
    double low,
    double volume,
    Instant timestamp,

    // Returns
    double return1,
    double return4,
    double return24,
    double return168,

    // Volatility
    double volatility24,
    double volatility168,
    double atr14,

    // Volume
    double volumeZScore,
    double avgVolume24,
    double volumeRatio,

    // Price
    double vwap24,
    double momentum14,

    MarketRegime marketRegime,

    CandleInterval interval,
    int candlesUsed,
    Instant computedAt
) {
    public boolean isTrending() {
        return marketRegime == MarketRegime.TRENDING_UP || marketRegime == MarketRegime.TRENDING_DOWN;
    }
}
