package io.sentix.transport.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sentix.domain.indicator.IndicatorSnapshot;
import io.sentix.domain.signal.Signal;
import io.sentix.service.batch.BatchResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * JSON rendering of signals and batch results.
 *
 * Enum values are written lower-case ("strong_up", "confirming_down"), except
 * the action which stays BUY / SELL / HOLD. Indicator values are rounded for
 * display (RSI / %B / ATR% to 1-2 decimals, MACD histogram to 6).
 */
public final class SignalJsonMapper {

    private final ObjectMapper mapper;

    public SignalJsonMapper() {
        this(new ObjectMapper());
    }

    public SignalJsonMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toJson(Signal signal) {
        ObjectNode node = mapper.createObjectNode();
        node.put("asset", signal.asset());
        node.put("action", signal.action().name());
        node.put("strengthLabel", signal.strengthLabel().getDisplay());
        node.put("score", signal.score());
        node.put("rawScore", signal.rawScore());
        node.put("confidence", signal.confidence());
        node.put("price", signal.price());
        node.put("change24h", signal.change24h());
        node.put("reasons", signal.reasonSummary());
        if (signal.hasSufficientData()) {
            node.set("indicators", indicators(signal.indicators()));
        }
        node.put("dataSource", signal.dataSource());
        node.put("interval", signal.interval());
        node.put("candlesAnalyzed", signal.candlesAnalyzed());
        node.put("timestamp", signal.timestamp().toString());
        return node;
    }

    public ArrayNode toJson(List<Signal> signals) {
        ArrayNode array = mapper.createArrayNode();
        for (Signal signal : signals) {
            array.add(toJson(signal));
        }
        return array;
    }

    public ObjectNode toJson(BatchResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.put("durationMs", result.duration().toMillis());
        node.put("total", result.all().size());
        node.put("degraded", result.degradedCount());
        node.set("signals", toJson(result.actionable()));
        node.set("critical", toJson(result.critical()));
        return node;
    }

    public String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON: " + e.getOriginalMessage(), e);
        }
    }

    private ObjectNode indicators(IndicatorSnapshot s) {
        ObjectNode node = mapper.createObjectNode();
        node.put("rsi", round(s.rsi().value(), 1));
        node.put("macd", round(s.macd().histogram(), 6));
        node.put("macdTrend", lower(s.macd().histogramTrend()));

        ObjectNode bollinger = node.putObject("bollinger");
        bollinger.put("position", s.bollinger().position());
        bollinger.put("percentB", round(s.bollinger().percentB() * 100, 1));

        node.put("adx", s.adx().adx());
        node.put("adxTrend", lower(s.adx().trend()));
        node.put("emaTrend", lower(s.emaTrend().direction()));
        node.put("divergence", lower(s.divergence().type()));
        node.put("volumeProfile", lower(s.volumeProfile().profile()));
        node.put("buyPressure", s.volumeProfile().buyPressure());
        node.put("bbSqueeze", s.squeeze().squeeze());
        node.put("atrPercent", round(s.atrPercent(), 2));

        ObjectNode levels = node.putObject("supportResistance");
        levels.put("support", s.supportResistance().support());
        levels.put("resistance", s.supportResistance().resistance());
        levels.put("pivot", s.supportResistance().pivot());
        return node;
    }

    private static BigDecimal round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
