package io.sentix.service.feature;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;
import io.sentix.domain.feature.MarketFeatures;
import io.sentix.infrastructure.provider.ProviderException;
import io.sentix.service.candle.CandleCacheKey;
import io.sentix.service.candle.CandleProvider;
import io.sentix.service.candle.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Feature Store - precomputed market features per (asset, interval), cached
 * for five minutes.
 */
public final class FeatureStore {
    private static final Logger log = LoggerFactory.getLogger(FeatureStore.class);

    public static final Duration FEATURE_TTL = Duration.ofMinutes(5);
    public static final int CANDLE_LIMIT = 200;

    private final CandleProvider candleProvider;
    private final TtlCache<CandleCacheKey, MarketFeatures> cache;
    private final Executor executor;
    private final Clock clock;

    public FeatureStore(
        CandleProvider candleProvider,
        TtlCache<CandleCacheKey, MarketFeatures> cache,
        Executor executor,
        Clock clock
    ) {
        this.candleProvider = candleProvider;
        this.cache = cache;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Cached features when fresh (unless forceRefresh), otherwise recomputed
     * from the provider. Empty when there are fewer than 50 candles.
     *
     * @throws ProviderException when the candle fetch fails
     */
    public Optional<MarketFeatures> getFeatures(String assetId, CandleInterval interval, boolean forceRefresh) {
        CandleCacheKey key = new CandleCacheKey(assetId, interval);
        if (!forceRefresh) {
            Optional<MarketFeatures> cached = cache.get(key);
            if (cached.isPresent()) {
                return cached;
            }
        }

        List<Candle> candles = candleProvider.fetchCandles(assetId, interval, CANDLE_LIMIT);
        Optional<MarketFeatures> features = FeatureCalculator.compute(candles, interval, clock.instant());
        if (features.isEmpty()) {
            log.warn("[FeatureStore] Insufficient candles for {} {}: {}", assetId, interval.getCode(), candles.size());
            return features;
        }

        MarketFeatures computed = features.get();
        cache.put(key, computed, FEATURE_TTL);
        log.debug("[FeatureStore] {} {} price={} return24={} vol24={} regime={}",
            assetId, interval.getCode(), computed.price(),
            String.format("%.2f", computed.return24()),
            String.format("%.2f", computed.volatility24()),
            computed.marketRegime());
        return features;
    }

    public Optional<MarketFeatures> getFeatures(String assetId, CandleInterval interval) {
        return getFeatures(assetId, interval, false);
    }

    /**
     * Features for several assets in parallel. Assets that fail or lack data
     * are left out; the map keeps input order.
     */
    public Map<String, MarketFeatures> getFeaturesForAssets(List<String> assetIds, CandleInterval interval) {
        List<CompletableFuture<Optional<MarketFeatures>>> futures = new ArrayList<>();
        for (String assetId : assetIds) {
            futures.add(CompletableFuture
                .supplyAsync(() -> getFeatures(assetId, interval), executor)
                .exceptionally(e -> {
                    log.error("[FeatureStore] Feature fetch failed for {}: {}", assetId, e.getMessage());
                    return Optional.empty();
                }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<String, MarketFeatures> result = new LinkedHashMap<>();
        for (int i = 0; i < assetIds.size(); i++) {
            Optional<MarketFeatures> features = futures.get(i).join();
            if (features.isPresent()) {
                result.put(assetIds.get(i), features.get());
            }
        }
        return result;
    }

    public void clear() {
        int size = cache.size();
        cache.clear();
        log.info("[FeatureStore] Cache cleared ({} entries)", size);
    }

    public CacheStats getCacheStats() {
        int size = cache.size();
        int fresh = cache.freshCount();
        return new CacheStats(size, FEATURE_TTL, fresh, size - fresh);
    }

    /**
     * Cache statistics snapshot.
     */
    public record CacheStats(int size, Duration ttl, int fresh, int stale) {
    }
}
