package io.sentix.infrastructure.metrics;

import io.sentix.domain.signal.Signal;
import io.sentix.infrastructure.provider.ProviderErrorType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of SignalMetrics.
 *
 * Key Metrics:
 * - sentix_signals_total{action} - Signals produced
 * - sentix_signal_confidence{action} - Confidence distribution
 * - sentix_batch_duration_seconds - Batch wall time
 * - sentix_batch_actionable / sentix_batch_critical - Size of the last batch lists
 * - sentix_candle_fetch_failures_total{provider, error_type} - Provider failures
 * - sentix_degraded_assets_total - Assets classified without enough candles
 */
public class PrometheusSignalMetrics implements SignalMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusSignalMetrics.class);

    private final CollectorRegistry registry;

    private final Counter signalCounter;
    private final Histogram signalConfidence;

    private final Histogram batchDuration;
    private final Gauge batchAssets;
    private final Gauge batchActionable;
    private final Gauge batchCritical;

    private final Counter fetchFailureCounter;
    private final Counter degradedCounter;

    public PrometheusSignalMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSignalMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.signalCounter = Counter.build()
            .name("sentix_signals_total")
            .help("Total number of signals produced")
            .labelNames("action")
            .register(registry);

        this.signalConfidence = Histogram.build()
            .name("sentix_signal_confidence")
            .help("Signal confidence (0-85)")
            .labelNames("action")
            .buckets(15, 25, 40, 50, 60, 70, 85)
            .register(registry);

        this.batchDuration = Histogram.build()
            .name("sentix_batch_duration_seconds")
            .help("Batch classification duration in seconds")
            .buckets(0.1, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0)
            .register(registry);

        this.batchAssets = Gauge.build()
            .name("sentix_batch_assets")
            .help("Number of assets in the last batch")
            .register(registry);

        this.batchActionable = Gauge.build()
            .name("sentix_batch_actionable")
            .help("Actionable signals in the last batch")
            .register(registry);

        this.batchCritical = Gauge.build()
            .name("sentix_batch_critical")
            .help("Critical signals in the last batch")
            .register(registry);

        this.fetchFailureCounter = Counter.build()
            .name("sentix_candle_fetch_failures_total")
            .help("Total number of failed candle fetches")
            .labelNames("provider", "error_type")
            .register(registry);

        this.degradedCounter = Counter.build()
            .name("sentix_degraded_assets_total")
            .help("Assets classified on the insufficient-data path")
            .register(registry);

        log.info("[PrometheusSignalMetrics] Initialized");
    }

    @Override
    public void recordSignal(Signal signal) {
        String action = signal.action().name();
        signalCounter.labels(action).inc();
        signalConfidence.labels(action).observe(signal.confidence());
    }

    @Override
    public void recordBatch(Duration duration, int assets, int actionable, int critical) {
        batchDuration.observe(duration.toMillis() / 1000.0);
        batchAssets.set(assets);
        batchActionable.set(actionable);
        batchCritical.set(critical);
    }

    @Override
    public void recordFetchFailure(String provider, ProviderErrorType errorType) {
        fetchFailureCounter.labels(provider, errorType.name()).inc();
    }

    @Override
    public void recordDegradedAsset(String assetId) {
        degradedCounter.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
