package io.sentix.infrastructure.binance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;
import io.sentix.infrastructure.provider.ProviderErrorType;
import io.sentix.infrastructure.provider.ProviderException;
import io.sentix.infrastructure.provider.ProviderHttp;
import io.sentix.infrastructure.provider.RetryPolicy;
import io.sentix.service.candle.CandleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binance public klines client (no authentication).
 *
 * GET {baseUrl}/api/v3/klines?symbol=BTCUSDT&amp;interval=1h&amp;limit=200
 *
 * Each kline is an array: [openTime, open, high, low, close, volume, closeTime, ...]
 * with prices and volume as strings.
 */
public final class BinanceCandleProvider implements CandleProvider {
    private static final Logger log = LoggerFactory.getLogger(BinanceCandleProvider.class);

    public static final String PROVIDER = "Binance";
    public static final String DEFAULT_BASE_URL = "https://api.binance.com";
    public static final int MAX_LIMIT = 1000;

    private static final String KLINES_PATH = "/api/v3/klines";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final RequestRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Duration requestTimeout;

    public BinanceCandleProvider(
        HttpClient httpClient,
        ObjectMapper objectMapper,
        String baseUrl,
        RequestRateLimiter rateLimiter,
        RetryPolicy retryPolicy,
        Duration requestTimeout
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<Candle> fetchCandles(String assetId, CandleInterval interval, int limit) {
        String symbol = BinanceSymbols.resolve(assetId).orElseThrow(() -> new ProviderException(
            PROVIDER, ProviderErrorType.CLIENT_ERROR, KLINES_PATH, null,
            "No Binance symbol mapping for asset: " + assetId));

        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }

        String endpoint = KLINES_PATH + "/" + symbol + "/" + interval.getCode();
        return retryPolicy.execute(endpoint, () -> fetchOnce(symbol, interval, limit, endpoint));
    }

    @Override
    public String getDataSource() {
        return "BINANCE_OHLCV";
    }

    private List<Candle> fetchOnce(String symbol, CandleInterval interval, int limit, String endpoint) {
        if (!rateLimiter.tryAcquire()) {
            long waitSeconds = (rateLimiter.resetIn().toMillis() + 999) / 1000;
            log.warn("[Binance] Local rate limit reached, window resets in {}s", waitSeconds);
            throw new ProviderException(PROVIDER, ProviderErrorType.RATE_LIMIT, endpoint, null,
                "Rate limited. Wait " + waitSeconds + "s");
        }

        URI uri = URI.create(baseUrl + KLINES_PATH
            + "?symbol=" + symbol
            + "&interval=" + interval.getCode()
            + "&limit=" + limit);

        String body = ProviderHttp.getJson(httpClient, PROVIDER, endpoint, uri, requestTimeout);

        List<Candle> candles = parseKlines(body, endpoint);
        if (log.isDebugEnabled() && !candles.isEmpty()) {
            log.debug("[Binance] {} {}: {} candles {} to {}", symbol, interval.getCode(), candles.size(),
                candles.get(0).timestamp(), candles.get(candles.size() - 1).timestamp());
        }
        return candles;
    }

    /**
     * Parse a klines payload into candles, oldest first.
     */
    List<Candle> parseKlines(String body, String endpoint) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw invalid(endpoint, "Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw invalid(endpoint, "Expected a JSON array of klines", null);
        }

        List<Candle> candles = new ArrayList<>(root.size());
        for (JsonNode kline : root) {
            if (!kline.isArray() || kline.size() < 6) {
                throw invalid(endpoint, "Kline must be an array of at least 6 fields", null);
            }
            try {
                candles.add(Candle.of(
                    kline.get(0).asLong(),
                    parseDecimal(kline.get(1)),
                    parseDecimal(kline.get(2)),
                    parseDecimal(kline.get(3)),
                    parseDecimal(kline.get(4)),
                    parseDecimal(kline.get(5))
                ));
            } catch (IllegalArgumentException e) {
                throw invalid(endpoint, "Bad kline value: " + e.getMessage(), e);
            }
        }
        return candles;
    }

    private static double parseDecimal(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        return Double.parseDouble(node.asText());
    }

    private static ProviderException invalid(String endpoint, String message, Throwable cause) {
        return new ProviderException(PROVIDER, ProviderErrorType.INVALID_RESPONSE, endpoint, null, message, cause);
    }
}
