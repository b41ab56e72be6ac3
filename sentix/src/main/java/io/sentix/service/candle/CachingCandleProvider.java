package io.sentix.service.candle;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;
import io.sentix.domain.data.CandleSeries;
import io.sentix.infrastructure.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Candle provider decorator with a TTL cache and stale fallback.
 *
 * Flow:
 * 1. Fresh entry for (asset, interval) fetched for at least limit candles →
 *    trailing limit candles from it; a fresh entry fetched for fewer is a miss
 * 2. Otherwise fetch from the delegate; a non-empty result replaces the entry
 * 3. Delegate failure or empty result → stale entry if one exists, otherwise
 *    the failure propagates (or the empty list is returned)
 *
 * Entries are whole immutable lists, so a reader sees either the previous or
 * the new series, never a mix. Concurrent misses on the same key may fetch twice.
 */
public final class CachingCandleProvider implements CandleProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingCandleProvider.class);

    private final CandleProvider delegate;
    private final TtlCache<CandleCacheKey, CachedCandles> cache;

    public CachingCandleProvider(CandleProvider delegate, TtlCache<CandleCacheKey, CachedCandles> cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public List<Candle> fetchCandles(String assetId, CandleInterval interval, int limit) {
        CandleCacheKey key = new CandleCacheKey(assetId, interval);

        Optional<CachedCandles> fresh = cache.get(key);
        if (fresh.isPresent()) {
            if (fresh.get().covers(limit)) {
                log.debug("[CandleCache] Hit {} {}", assetId, interval.getCode());
                return CandleSeries.tail(fresh.get().candles(), limit);
            }
            log.debug("[CandleCache] {} {} cached for {} candles, {} requested, refetching",
                assetId, interval.getCode(), fresh.get().requestedLimit(), limit);
        }

        List<Candle> fetched;
        try {
            fetched = delegate.fetchCandles(assetId, interval, limit);
        } catch (ProviderException e) {
            Optional<List<Candle>> stale = cache.getStale(key).map(CachedCandles::candles);
            if (stale.isPresent()) {
                log.warn("[CandleCache] {} {} fetch failed ({}), serving {} stale candles",
                    assetId, interval.getCode(), e.getErrorType(), stale.get().size());
                return CandleSeries.tail(stale.get(), limit);
            }
            throw e;
        }

        if (fetched.isEmpty()) {
            Optional<List<Candle>> stale = cache.getStale(key).map(CachedCandles::candles);
            if (stale.isPresent()) {
                log.warn("[CandleCache] {} {} returned no candles, serving {} stale candles",
                    assetId, interval.getCode(), stale.get().size());
                return CandleSeries.tail(stale.get(), limit);
            }
            return fetched;
        }

        CachedCandles entry = new CachedCandles(fetched, limit);
        cache.put(key, entry, interval.cacheTtl());
        log.debug("[CandleCache] Stored {} candles for {} {}", entry.candles().size(), assetId, interval.getCode());
        return entry.candles();
    }

    @Override
    public String getDataSource() {
        return delegate.getDataSource();
    }

    @Override
    public String dataSourceFor(String assetId) {
        return delegate.dataSourceFor(assetId);
    }
}
