package io.sentix.infrastructure.coincap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;
import io.sentix.domain.data.CandleSeries;
import io.sentix.infrastructure.provider.ProviderErrorType;
import io.sentix.infrastructure.provider.ProviderException;
import io.sentix.infrastructure.provider.ProviderHttp;
import io.sentix.service.candle.CandleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CoinCap price history as synthetic candles (last-resort source).
 *
 * GET {baseUrl}/v2/assets/{id}/history?interval=h1|d1&amp;start={ms}&amp;end={ms}
 *
 * The window covers {@code limit} days back from now, hourly points when that
 * is at most a week, daily otherwise. CoinCap reports no volume.
 */
public final class CoinCapCandleProvider implements CandleProvider {
    private static final Logger log = LoggerFactory.getLogger(CoinCapCandleProvider.class);

    public static final String PROVIDER = "CoinCap";
    public static final String DEFAULT_BASE_URL = "https://api.coincap.io";

    private static final String HISTORY_PATH = "/v2/assets/%s/history";
    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    // CoinGecko id → CoinCap id where they differ
    private static final Map<String, String> ASSET_IDS = Map.of(
        "binancecoin", "binance-coin",
        "ripple", "xrp",
        "avalanche-2", "avalanche"
    );

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final Clock clock;

    public CoinCapCandleProvider(
        HttpClient httpClient,
        ObjectMapper objectMapper,
        String baseUrl,
        Duration requestTimeout,
        Clock clock
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
    }

    /**
     * @return CoinCap asset id for a CoinGecko style id (identity when unmapped)
     */
    public static String resolveId(String assetId) {
        return ASSET_IDS.getOrDefault(assetId, assetId);
    }

    @Override
    public List<Candle> fetchCandles(String assetId, CandleInterval interval, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }

        String path = String.format(HISTORY_PATH, URLEncoder.encode(resolveId(assetId), StandardCharsets.UTF_8));
        long end = clock.millis();
        long start = end - limit * DAY_MILLIS;
        String granularity = limit <= 7 ? "h1" : "d1";
        URI uri = URI.create(baseUrl + path
            + "?interval=" + granularity
            + "&start=" + start
            + "&end=" + end);

        String body = ProviderHttp.getJson(httpClient, PROVIDER, path, uri, requestTimeout);
        List<Candle> candles = CandleSeries.tail(parseHistory(body, path), limit);
        if (!candles.isEmpty()) {
            log.info("[CoinCap] {} history fallback OK: {} points ({})", assetId, candles.size(), granularity);
        }
        return candles;
    }

    @Override
    public String getDataSource() {
        return "COINCAP_HISTORY";
    }

    /**
     * Parse a history payload {"data": [{"priceUsd": "...", "time": ms}, ...]}.
     * Points whose price does not parse to a positive number are skipped.
     */
    List<Candle> parseHistory(String body, String endpoint) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw invalid(endpoint, "Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid(endpoint, "Expected a JSON object", null);
        }

        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            return List.of();
        }
        if (!data.isArray()) {
            throw invalid(endpoint, "data must be an array", null);
        }

        List<Candle> candles = new ArrayList<>(data.size());
        for (JsonNode point : data) {
            if (!point.path("time").isNumber()) {
                throw invalid(endpoint, "History point without numeric time", null);
            }
            double price = parsePrice(point.path("priceUsd"));
            if (!(price > 0) || Double.isInfinite(price)) {
                continue;
            }
            candles.add(Candle.fromPrice(point.get("time").asLong(), price, 0));
        }
        return candles;
    }

    private static double parsePrice(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static ProviderException invalid(String endpoint, String message, Throwable cause) {
        return new ProviderException(PROVIDER, ProviderErrorType.INVALID_RESPONSE, endpoint, null, message, cause);
    }
}
