package io.sentix.config;

import io.sentix.domain.data.CandleInterval;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SignalEngineConfig.
 *
 * Overrides are passed as system properties, which Env reads after the environment.
 */
class SignalEngineConfigTest {

    private static final List<String> KEYS = List.of(
        "SENTIX_ASSETS", "SENTIX_CANDLE_INTERVAL", "SENTIX_FETCH_TIMEOUT_SECONDS", "SENTIX_FEAR_GREED");

    @AfterEach
    void tearDown() {
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void testDefaults() {
        SignalEngineConfig config = SignalEngineConfig.defaults();

        assertEquals(10, config.assets().size());
        assertEquals("bitcoin", config.assets().get(0));
        assertEquals(CandleInterval.HOUR_1, config.interval());
        assertEquals(200, config.candleLimit());
        assertEquals(Duration.ofSeconds(15), config.fetchTimeout());
        assertEquals(4, config.fetchThreads());
        assertEquals("https://api.binance.com", config.binanceBaseUrl());
        assertEquals("https://api.coingecko.com", config.coinGeckoBaseUrl());
        assertEquals("https://api.coincap.io", config.coinCapBaseUrl());
        assertEquals(100, config.rateLimitPerMinute());
        assertEquals(50, config.fearGreed());
        assertTrue(config.isValid());
    }

    @Test
    void testFromEnvOverrides() {
        System.setProperty("SENTIX_ASSETS", "bitcoin, solana,,");
        System.setProperty("SENTIX_CANDLE_INTERVAL", "4h");
        System.setProperty("SENTIX_FETCH_TIMEOUT_SECONDS", "30");
        System.setProperty("SENTIX_FEAR_GREED", "22");

        SignalEngineConfig config = SignalEngineConfig.fromEnv();

        assertEquals(List.of("bitcoin", "solana"), config.assets());
        assertEquals(CandleInterval.HOUR_4, config.interval());
        assertEquals(100, config.candleLimit(), "Limit follows the interval default");
        assertEquals(Duration.ofSeconds(30), config.fetchTimeout());
        assertEquals(22, config.fearGreed());
        assertTrue(config.isValid());
    }

    @Test
    void testInvalidInterval() {
        System.setProperty("SENTIX_CANDLE_INTERVAL", "7h");

        assertThrows(IllegalArgumentException.class, SignalEngineConfig::fromEnv);
    }

    @Test
    void testValidation() {
        SignalEngineConfig d = SignalEngineConfig.defaults();

        assertFalse(new SignalEngineConfig(List.of(), d.interval(), 200, d.fetchTimeout(), 4,
            d.binanceBaseUrl(), d.coinGeckoBaseUrl(), d.coinCapBaseUrl(), 100, 50, d.filter()).isValid(), "No assets");
        assertFalse(new SignalEngineConfig(d.assets(), d.interval(), 1001, d.fetchTimeout(), 4,
            d.binanceBaseUrl(), d.coinGeckoBaseUrl(), d.coinCapBaseUrl(), 100, 50, d.filter()).isValid(), "Limit above Binance maximum");
        assertFalse(new SignalEngineConfig(d.assets(), d.interval(), 200, Duration.ZERO, 4,
            d.binanceBaseUrl(), d.coinGeckoBaseUrl(), d.coinCapBaseUrl(), 100, 50, d.filter()).isValid(), "Zero timeout");
        assertFalse(new SignalEngineConfig(d.assets(), d.interval(), 200, d.fetchTimeout(), 4,
            d.binanceBaseUrl(), d.coinGeckoBaseUrl(), d.coinCapBaseUrl(), 100, 120, d.filter()).isValid(), "Fear & Greed out of range");
    }
}
