package io.sentix.infrastructure.metrics;

import io.sentix.domain.signal.Signal;
import io.sentix.infrastructure.provider.ProviderErrorType;

import java.time.Duration;

/**
 * Signal engine metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Signals produced by action
 * - Signal confidence distribution
 * - Batch duration and sizes
 * - Candle fetch failures by error type
 * - Assets degraded to the insufficient-data path
 */
public interface SignalMetrics {

    /**
     * Record one classified signal.
     */
    void recordSignal(Signal signal);

    /**
     * Record a finished batch run.
     *
     * @param duration   Wall time of the batch
     * @param assets     Number of assets requested
     * @param actionable Signals passing the confidence floor
     * @param critical   Signals passing the critical filter
     */
    void recordBatch(Duration duration, int assets, int actionable, int critical);

    /**
     * Record a failed candle fetch.
     *
     * @param provider  Provider name
     * @param errorType Failure category
     */
    void recordFetchFailure(String provider, ProviderErrorType errorType);

    /**
     * Record an asset that fell back to the insufficient-data HOLD.
     */
    void recordDegradedAsset(String assetId);
}
