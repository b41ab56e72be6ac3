package io.sentix.infrastructure.binance;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * CoinGecko asset id → Binance USDT symbol.
 */
public final class BinanceSymbols {

    private static final Map<String, String> SYMBOLS = Map.of(
        "bitcoin", "BTCUSDT",
        "ethereum", "ETHUSDT",
        "binancecoin", "BNBUSDT",
        "solana", "SOLUSDT",
        "cardano", "ADAUSDT",
        "ripple", "XRPUSDT",
        "polkadot", "DOTUSDT",
        "dogecoin", "DOGEUSDT",
        "avalanche-2", "AVAXUSDT",
        "chainlink", "LINKUSDT"
    );

    private BinanceSymbols() {
    }

    /**
     * Mapped symbol, or the id itself (upper-cased) when it already is a USDT pair.
     */
    public static Optional<String> resolve(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            return Optional.empty();
        }
        String mapped = SYMBOLS.get(assetId.toLowerCase(Locale.ROOT));
        if (mapped != null) {
            return Optional.of(mapped);
        }
        String upper = assetId.toUpperCase(Locale.ROOT);
        return upper.endsWith("USDT") ? Optional.of(upper) : Optional.empty();
    }

    public static Map<String, String> all() {
        return SYMBOLS;
    }
}
