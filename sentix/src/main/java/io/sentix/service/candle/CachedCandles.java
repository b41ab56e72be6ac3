package io.sentix.service.candle;

import io.sentix.domain.data.Candle;

import java.util.List;

/**
 * Cached candle series together with the limit it was fetched for.
 *
 * The upstream may return fewer candles than requested (young listings), so
 * coverage is judged by the requested limit, not by the series size.
 */
public record CachedCandles(List<Candle> candles, int requestedLimit) {

    public CachedCandles {
        candles = List.copyOf(candles);
    }

    /**
     * @return true if this entry was fetched for at least {@code limit} candles
     */
    public boolean covers(int limit) {
        return requestedLimit >= limit;
    }
}
