package io.sentix.domain.feature;

/**
 * Market regime over the last 50 candles.
 */
public enum MarketRegime {
    TRENDING_UP,
    TRENDING_DOWN,
    RANGING,
    VOLATILE,
    UNKNOWN
}
