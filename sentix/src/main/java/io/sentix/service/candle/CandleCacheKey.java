package io.sentix.service.candle;

import io.sentix.domain.data.CandleInterval;

/**
 * Cache key for a candle series.
 */
public record CandleCacheKey(String assetId, CandleInterval interval) {
}
