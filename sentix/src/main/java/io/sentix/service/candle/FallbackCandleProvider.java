package io.sentix.service.candle;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;
import io.sentix.infrastructure.metrics.SignalMetrics;
import io.sentix.infrastructure.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Candle provider chain: the primary source first, then each fallback in order.
 *
 * Flow:
 * 1. Ask each provider in turn; a failure or an empty result moves on to the next
 * 2. First non-empty result wins and its provider becomes the asset's data source
 * 3. Every provider failed → the last failure propagates (earlier ones suppressed)
 * 4. Some provider answered empty and none succeeded → empty list
 *
 * Failures that are absorbed by a later provider are recorded in metrics here;
 * a propagated failure is left to the caller.
 */
public final class FallbackCandleProvider implements CandleProvider {
    private static final Logger log = LoggerFactory.getLogger(FallbackCandleProvider.class);

    private final List<CandleProvider> providers;
    private final SignalMetrics metrics;
    private final Map<String, String> lastSource = new ConcurrentHashMap<>();

    public FallbackCandleProvider(List<CandleProvider> providers, SignalMetrics metrics) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one candle provider is required");
        }
        this.providers = List.copyOf(providers);
        this.metrics = metrics;
    }

    @Override
    public List<Candle> fetchCandles(String assetId, CandleInterval interval, int limit) {
        List<ProviderException> failures = new ArrayList<>();
        boolean answered = false;

        for (int i = 0; i < providers.size(); i++) {
            CandleProvider provider = providers.get(i);
            List<Candle> candles;
            try {
                candles = provider.fetchCandles(assetId, interval, limit);
            } catch (ProviderException e) {
                log.warn("[Fallback] {} {} failed on {}: {}", assetId, interval.getCode(),
                    provider.getDataSource(), e.getMessage());
                failures.add(e);
                continue;
            }
            answered = true;
            if (candles.isEmpty()) {
                log.warn("[Fallback] {} {} got no candles from {}", assetId, interval.getCode(),
                    provider.getDataSource());
                continue;
            }

            recordAbsorbed(failures, failures.size());
            if (i > 0) {
                log.warn("[Fallback] {} {} served by {} ({} candles)", assetId, interval.getCode(),
                    provider.getDataSource(), candles.size());
            }
            lastSource.put(assetId, provider.getDataSource());
            return candles;
        }

        if (answered) {
            recordAbsorbed(failures, failures.size());
            log.error("[Fallback] All candle sources returned nothing for {} {}", assetId, interval.getCode());
            return List.of();
        }

        recordAbsorbed(failures, failures.size() - 1);
        ProviderException last = failures.get(failures.size() - 1);
        for (int i = 0; i < failures.size() - 1; i++) {
            last.addSuppressed(failures.get(i));
        }
        log.error("[Fallback] All candle sources failed for {} {}", assetId, interval.getCode());
        throw last;
    }

    @Override
    public String getDataSource() {
        return providers.get(0).getDataSource();
    }

    /**
     * Source of the candles last served for the asset, the primary's label
     * before any fetch has succeeded.
     */
    @Override
    public String dataSourceFor(String assetId) {
        return lastSource.getOrDefault(assetId, getDataSource());
    }

    private void recordAbsorbed(List<ProviderException> failures, int count) {
        for (int i = 0; i < count; i++) {
            ProviderException e = failures.get(i);
            metrics.recordFetchFailure(e.getProvider(), e.getErrorType());
        }
    }
}
