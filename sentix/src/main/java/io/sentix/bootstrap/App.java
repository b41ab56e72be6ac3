package io.sentix.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sentix.config.SignalEngineConfig;
import io.sentix.domain.signal.AssetQuote;
import io.sentix.domain.signal.MacroContext;
import io.sentix.infrastructure.binance.BinanceCandleProvider;
import io.sentix.infrastructure.binance.RequestRateLimiter;
import io.sentix.infrastructure.coincap.CoinCapCandleProvider;
import io.sentix.infrastructure.coingecko.CoinGeckoCandleProvider;
import io.sentix.infrastructure.metrics.PrometheusSignalMetrics;
import io.sentix.infrastructure.provider.RetryPolicy;
import io.sentix.service.batch.BatchResult;
import io.sentix.service.batch.SignalBatchProcessor;
import io.sentix.service.candle.CachedCandles;
import io.sentix.service.candle.CachingCandleProvider;
import io.sentix.service.candle.CandleCacheKey;
import io.sentix.service.candle.CandleProvider;
import io.sentix.service.candle.FallbackCandleProvider;
import io.sentix.service.candle.InMemoryTtlCache;
import io.sentix.service.signal.SignalClassifier;
import io.sentix.transport.json.SignalJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point (NO Spring).
 *
 * Runs one batch classification over the configured assets and prints the
 * actionable and critical signals as JSON on stdout.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Sentix Signal Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        SignalEngineConfig config = SignalEngineConfig.fromEnv();
        if (!config.isValid()) {
            log.error("❌ Invalid configuration: {}", config);
            System.exit(1);
        }

        Clock clock = Clock.systemUTC();
        ObjectMapper objectMapper = new ObjectMapper();

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusSignalMetrics metrics = new PrometheusSignalMetrics();

        // ═══════════════════════════════════════════════════════════════
        // Candle providers: Binance klines, CoinGecko / CoinCap fallbacks, TTL cache
        // ═══════════════════════════════════════════════════════════════
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        BinanceCandleProvider binance = new BinanceCandleProvider(
            httpClient,
            objectMapper,
            config.binanceBaseUrl(),
            new RequestRateLimiter(config.rateLimitPerMinute(), Duration.ofMinutes(1), clock),
            RetryPolicy.forMarketData(),
            Duration.ofSeconds(10)
        );
        CoinGeckoCandleProvider coinGecko = new CoinGeckoCandleProvider(
            httpClient, objectMapper, config.coinGeckoBaseUrl(), Duration.ofSeconds(12));
        CoinCapCandleProvider coinCap = new CoinCapCandleProvider(
            httpClient, objectMapper, config.coinCapBaseUrl(), Duration.ofSeconds(10), clock);

        CandleProvider candles = new CachingCandleProvider(
            new FallbackCandleProvider(List.of(binance, coinGecko, coinCap), metrics),
            new InMemoryTtlCache<CandleCacheKey, CachedCandles>(clock));
        log.info("✓ Candle provider: {} ({}), fallbacks {} / {}", config.binanceBaseUrl(),
            config.interval().getCode(), config.coinGeckoBaseUrl(), config.coinCapBaseUrl());

        // ═══════════════════════════════════════════════════════════════
        // Batch run
        // ═══════════════════════════════════════════════════════════════
        List<AssetQuote> quotes = new ArrayList<>();
        for (String assetId : config.assets()) {
            quotes.add(AssetQuote.of(assetId));
        }
        MacroContext macro = new MacroContext(config.fearGreed(), fearLabel(config.fearGreed()));

        SignalJsonMapper json = new SignalJsonMapper(objectMapper);
        try (SignalBatchProcessor processor = new SignalBatchProcessor(
            candles, new SignalClassifier(clock), metrics, config.fetchThreads(), config.fetchTimeout())) {

            BatchResult result = processor.process(
                quotes, macro, config.interval(), config.candleLimit(), config.filter());
            System.out.println(json.write(json.toJson(result)));
        }
    }

    /**
     * Alternative.me style label for a Fear &amp; Greed value.
     */
    static String fearLabel(int value) {
        if (value < 25) return "Extreme Fear";
        if (value < 45) return "Fear";
        if (value <= 55) return "Neutral";
        if (value <= 75) return "Greed";
        return "Extreme Greed";
    }

    private App() {}
}
