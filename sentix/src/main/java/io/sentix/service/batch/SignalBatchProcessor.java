package io.sentix.service.batch;

import io.sentix.config.BatchFilterConfig;
import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;
import io.sentix.domain.signal.AssetQuote;
import io.sentix.domain.signal.MacroContext;
import io.sentix.domain.signal.Signal;
import io.sentix.domain.signal.SignalAction;
import io.sentix.infrastructure.metrics.SignalMetrics;
import io.sentix.infrastructure.provider.ProviderErrorType;
import io.sentix.infrastructure.provider.ProviderException;
import io.sentix.service.candle.CandleProvider;
import io.sentix.service.signal.SignalClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch Processor - classifies many assets in one run.
 *
 * Flow:
 * 1. Fetch each asset's candles in parallel, each bounded by the fetch timeout
 * 2. Classify per asset (failure or timeout → insufficient-data HOLD for that asset only)
 * 3. Keep BUY / SELL at or above the confidence floor, sort by confidence descending
 *    (ties keep input order)
 * 4. Apply the critical filter over the actionable list
 */
public final class SignalBatchProcessor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SignalBatchProcessor.class);

    private final CandleProvider candleProvider;
    private final SignalClassifier classifier;
    private final SignalMetrics metrics;
    private final ExecutorService executor;
    private final Duration fetchTimeout;
    private final Clock clock;

    public SignalBatchProcessor(
        CandleProvider candleProvider,
        SignalClassifier classifier,
        SignalMetrics metrics,
        int fetchThreads,
        Duration fetchTimeout
    ) {
        this(candleProvider, classifier, metrics, newFetchPool(fetchThreads), fetchTimeout, Clock.systemUTC());
    }

    public SignalBatchProcessor(
        CandleProvider candleProvider,
        SignalClassifier classifier,
        SignalMetrics metrics,
        ExecutorService executor,
        Duration fetchTimeout,
        Clock clock
    ) {
        this.candleProvider = candleProvider;
        this.classifier = classifier;
        this.metrics = metrics;
        this.executor = executor;
        this.fetchTimeout = fetchTimeout;
        this.clock = clock;
    }

    public BatchResult process(
        List<AssetQuote> quotes,
        MacroContext macro,
        CandleInterval interval,
        int limit,
        BatchFilterConfig filter
    ) {
        Instant start = clock.instant();
        log.info("[Batch] Classifying {} assets ({} x {})", quotes.size(), limit, interval.getCode());

        List<CompletableFuture<Signal>> futures = new ArrayList<>(quotes.size());
        for (AssetQuote quote : quotes) {
            futures.add(classifyAsync(quote, macro, interval, limit));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Signal> all = new ArrayList<>(futures.size());
        for (CompletableFuture<Signal> future : futures) {
            Signal signal = future.join();
            metrics.recordSignal(signal);
            all.add(signal);
        }

        List<Signal> actionable = filterActionable(all, filter.minConfidence());
        List<Signal> critical = filterCritical(actionable, filter);
        Duration duration = Duration.between(start, clock.instant());

        metrics.recordBatch(duration, quotes.size(), actionable.size(), critical.size());
        log.info("[Batch] Done in {}ms: {} signals, {} actionable, {} critical, {} degraded",
            duration.toMillis(), all.size(), actionable.size(), critical.size(),
            all.stream().filter(s -> !s.hasSufficientData()).count());

        return new BatchResult(all, actionable, critical, duration);
    }

    private CompletableFuture<Signal> classifyAsync(
        AssetQuote quote,
        MacroContext macro,
        CandleInterval interval,
        int limit
    ) {
        return CompletableFuture
            .supplyAsync(() -> candleProvider.fetchCandles(quote.assetId(), interval, limit), executor)
            .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((candles, error) -> {
                if (error != null) {
                    recordFailure(quote.assetId(), unwrap(error));
                    return classifier.insufficient(quote, List.of(), interval);
                }
                Signal signal;
                try {
                    signal = classifier.classify(
                        quote, candles, macro, interval, candleProvider.dataSourceFor(quote.assetId()));
                } catch (RuntimeException e) {
                    log.error("[Batch] {} classification failed, HOLD", quote.assetId(), e);
                    metrics.recordDegradedAsset(quote.assetId());
                    return classifier.insufficient(quote, candles, interval);
                }
                if (!signal.hasSufficientData()) {
                    log.warn("[Batch] {} has only {} candles, HOLD", quote.assetId(), candles.size());
                    metrics.recordDegradedAsset(quote.assetId());
                }
                return signal;
            });
    }

    private void recordFailure(String assetId, Throwable cause) {
        metrics.recordDegradedAsset(assetId);
        if (cause instanceof ProviderException) {
            ProviderException pe = (ProviderException) cause;
            metrics.recordFetchFailure(pe.getProvider(), pe.getErrorType());
            log.warn("[Batch] {} candle fetch failed: {}", assetId, pe.getMessage());
        } else if (cause instanceof TimeoutException) {
            metrics.recordFetchFailure(candleProvider.getDataSource(), ProviderErrorType.TIMEOUT);
            log.warn("[Batch] {} candle fetch timed out after {}ms", assetId, fetchTimeout.toMillis());
        } else {
            metrics.recordFetchFailure(candleProvider.getDataSource(), ProviderErrorType.UNKNOWN);
            log.error("[Batch] {} candle fetch error", assetId, cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * BUY / SELL signals with confidence ≥ floor, by confidence descending.
     * The sort is stable, so ties keep input order.
     */
    public static List<Signal> filterActionable(List<Signal> signals, int minConfidence) {
        List<Signal> result = new ArrayList<>();
        for (Signal signal : signals) {
            if (signal.isActionable() && signal.confidence() >= minConfidence) {
                result.add(signal);
            }
        }
        result.sort(Comparator.comparingInt(Signal::confidence).reversed());
        return result;
    }

    /**
     * Critical BUY / SELL signals, keeping the input order.
     */
    public static List<Signal> filterCritical(List<Signal> signals, BatchFilterConfig filter) {
        List<Signal> result = new ArrayList<>();
        for (Signal signal : signals) {
            if (isCritical(signal, filter)) {
                result.add(signal);
            }
        }
        return result;
    }

    static boolean isCritical(Signal signal, BatchFilterConfig filter) {
        if (signal.action() == SignalAction.BUY) {
            return signal.confidence() >= filter.buyMinConfidence()
                && signal.rawScore() >= filter.buyMinRawScore();
        }
        if (signal.action() == SignalAction.SELL) {
            return signal.confidence() >= filter.sellMinConfidence()
                && signal.rawScore() <= -filter.sellMinRawScore();
        }
        return false;
    }

    /**
     * Stop the fetch pool.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutorService newFetchPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "SignalFetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
