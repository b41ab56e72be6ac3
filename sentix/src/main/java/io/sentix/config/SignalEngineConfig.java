package io.sentix.config;

import io.sentix.domain.data.CandleInterval;
import io.sentix.util.Env;

import java.time.Duration;
import java.util.List;

/**
 * Runtime configuration of the signal engine.
 */
public record SignalEngineConfig(
    List<String> assets,
    CandleInterval interval,
    int candleLimit,
    Duration fetchTimeout,
    int fetchThreads,
    String binanceBaseUrl,
    String coinGeckoBaseUrl,
    String coinCapBaseUrl,
    int rateLimitPerMinute,
    int fearGreed,
    BatchFilterConfig filter
) {
    public static final List<String> DEFAULT_ASSETS = List.of(
        "bitcoin", "ethereum", "binancecoin", "solana", "cardano",
        "ripple", "polkadot", "dogecoin", "avalanche-2", "chainlink"
    );

    public SignalEngineConfig {
        assets = List.copyOf(assets);
    }

    public static SignalEngineConfig defaults() {
        CandleInterval interval = CandleInterval.HOUR_1;
        return new SignalEngineConfig(
            DEFAULT_ASSETS,
            interval,
            interval.defaultLimit(),
            Duration.ofSeconds(15),
            4,
            "https://api.binance.com",
            "https://api.coingecko.com",
            "https://api.coincap.io",
            100,
            50,
            BatchFilterConfig.defaults()
        );
    }

    /**
     * Read from SENTIX_* / BINANCE_* / COINGECKO_* / COINCAP_* environment variables (or system properties).
     * The candle limit defaults to the interval's default limit.
     */
    public static SignalEngineConfig fromEnv() {
        SignalEngineConfig d = defaults();
        CandleInterval interval = CandleInterval.fromCode(Env.get("SENTIX_CANDLE_INTERVAL", d.interval().getCode()));
        return new SignalEngineConfig(
            Env.getList("SENTIX_ASSETS", d.assets()),
            interval,
            Env.getInt("SENTIX_CANDLE_LIMIT", interval.defaultLimit()),
            Duration.ofSeconds(Env.getLong("SENTIX_FETCH_TIMEOUT_SECONDS", d.fetchTimeout().getSeconds())),
            Env.getInt("SENTIX_FETCH_THREADS", d.fetchThreads()),
            Env.get("BINANCE_BASE_URL", d.binanceBaseUrl()),
            Env.get("COINGECKO_BASE_URL", d.coinGeckoBaseUrl()),
            Env.get("COINCAP_BASE_URL", d.coinCapBaseUrl()),
            Env.getInt("BINANCE_RATE_LIMIT_PER_MINUTE", d.rateLimitPerMinute()),
            Env.getInt("SENTIX_FEAR_GREED", d.fearGreed()),
            BatchFilterConfig.fromEnv()
        );
    }

    /**
     * Validate configuration values.
     */
    public boolean isValid() {
        return !assets.isEmpty()
            && candleLimit >= 1 && candleLimit <= 1000
            && !fetchTimeout.isNegative() && !fetchTimeout.isZero()
            && fetchThreads > 0
            && rateLimitPerMinute > 0
            && fearGreed >= 0 && fearGreed <= 100
            && filter.isValid();
    }
}
