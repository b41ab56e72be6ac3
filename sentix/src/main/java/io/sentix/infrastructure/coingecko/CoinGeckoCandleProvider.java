package io.sentix.infrastructure.coingecko;

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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * CoinGecko daily price history as synthetic candles (fallback source).
 *
 * GET {baseUrl}/api/v3/coins/{id}/market_chart?vs_currency=usd&amp;days={limit}&amp;interval=daily
 *
 * The payload carries close prices only:
 * {"prices": [[ms, price], ...], "total_volumes": [[ms, volume], ...]}
 * so each point becomes a {@link Candle#fromPrice} candle. Points are daily
 * whatever interval is requested; the limit is read as a number of days.
 */
public final class CoinGeckoCandleProvider implements CandleProvider {
    private static final Logger log = LoggerFactory.getLogger(CoinGeckoCandleProvider.class);

    public static final String PROVIDER = "CoinGecko";
    public static final String DEFAULT_BASE_URL = "https://api.coingecko.com";

    private static final String MARKET_CHART_PATH = "/api/v3/coins/%s/market_chart";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    public CoinGeckoCandleProvider(
        HttpClient httpClient,
        ObjectMapper objectMapper,
        String baseUrl,
        Duration requestTimeout
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<Candle> fetchCandles(String assetId, CandleInterval interval, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }

        String path = String.format(MARKET_CHART_PATH, URLEncoder.encode(assetId, StandardCharsets.UTF_8));
        URI uri = URI.create(baseUrl + path
            + "?vs_currency=usd"
            + "&days=" + limit
            + "&interval=daily");

        String body = ProviderHttp.getJson(httpClient, PROVIDER, path, uri, requestTimeout);
        List<Candle> candles = CandleSeries.tail(parseMarketChart(body, path), limit);
        log.debug("[CoinGecko] {}: {} daily candles", assetId, candles.size());
        return candles;
    }

    @Override
    public String getDataSource() {
        return "COINGECKO_DAILY";
    }

    /**
     * Parse a market_chart payload. Volumes are matched to prices by position
     * (0 when missing); points with a non-positive price are skipped.
     */
    List<Candle> parseMarketChart(String body, String endpoint) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw invalid(endpoint, "Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid(endpoint, "Expected a JSON object", null);
        }

        JsonNode prices = root.path("prices");
        JsonNode volumes = root.path("total_volumes");
        if (prices.isMissingNode()) {
            return List.of();
        }
        if (!prices.isArray()) {
            throw invalid(endpoint, "prices must be an array", null);
        }

        List<Candle> candles = new ArrayList<>(prices.size());
        for (int i = 0; i < prices.size(); i++) {
            JsonNode point = prices.get(i);
            if (!point.isArray() || point.size() < 2 || !point.get(0).isNumber() || !point.get(1).isNumber()) {
                throw invalid(endpoint, "Price point must be [timestamp, price]", null);
            }
            double price = point.get(1).asDouble();
            if (!(price > 0) || Double.isInfinite(price)) {
                continue;
            }
            JsonNode volumePoint = volumes.path(i);
            double volume = volumePoint.path(1).isNumber() ? Math.max(0, volumePoint.get(1).asDouble()) : 0;
            candles.add(Candle.fromPrice(point.get(0).asLong(), price, volume));
        }
        return candles;
    }

    private static ProviderException invalid(String endpoint, String message, Throwable cause) {
        return new ProviderException(PROVIDER, ProviderErrorType.INVALID_RESPONSE, endpoint, null, message, cause);
    }
}
