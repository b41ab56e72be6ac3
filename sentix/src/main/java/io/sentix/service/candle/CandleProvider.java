package io.sentix.service.candle;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;

import java.util.List;

/**
 * Source of historical OHLCV candles.
 *
 * Implementations return candles oldest first and throw
 * {@link io.sentix.infrastructure.provider.ProviderException} on failure.
 */
public interface CandleProvider {

    /**
     * Fetch up to limit most recent candles.
     */
    List<Candle> fetchCandles(String assetId, CandleInterval interval, int limit);

    /**
     * Label carried on signals built from this provider's candles.
     */
    String getDataSource();

    /**
     * Label for the candles last served for an asset. Providers that switch
     * sources per request override this; by default it is {@link #getDataSource()}.
     */
    default String dataSourceFor(String assetId) {
        return getDataSource();
    }
}
