package io.sentix.service.signal;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;
import io.sentix.domain.data.CandleSeries;
import io.sentix.domain.indicator.IndicatorSnapshot;
import io.sentix.domain.signal.AssetQuote;
import io.sentix.domain.signal.MacroContext;
import io.sentix.domain.signal.Signal;
import io.sentix.domain.signal.SignalAction;
import io.sentix.domain.signal.StrengthLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Signal Classifier - one asset's candle series plus market context in, one
 * immutable Signal out.
 *
 * Flow:
 * 1. Fewer than 50 candles → defined HOLD (score 50, confidence 15)
 * 2. Resolve price (quote or last close) and 24h change (quote or one day of candles)
 * 3. Compute the indicator snapshot
 * 4. Score and resolve action / strength label
 *
 * Stateless apart from the clock; safe to share across threads.
 */
public final class SignalClassifier {
    private static final Logger log = LoggerFactory.getLogger(SignalClassifier.class);

    public static final int MIN_CANDLES = 50;
    public static final String INSUFFICIENT_REASON = "Insufficient data for reliable analysis";

    private final Clock clock;

    public SignalClassifier() {
        this(Clock.systemUTC());
    }

    public SignalClassifier(Clock clock) {
        this.clock = clock;
    }

    public Signal classify(
        AssetQuote quote,
        List<Candle> candles,
        MacroContext macro,
        CandleInterval interval,
        String dataSource
    ) {
        if (quote == null) {
            throw new IllegalArgumentException("Asset quote cannot be null");
        }
        List<Candle> series = candles != null ? candles : List.of();
        MacroContext context = macro != null ? macro : MacroContext.neutral();

        if (series.size() < MIN_CANDLES) {
            log.debug("[Signal] {} has {} candles, below {} - HOLD", quote.assetId(), series.size(), MIN_CANDLES);
            return insufficient(quote, series, interval);
        }

        double price = resolvePrice(quote, series);
        double change24h = resolveChange24h(quote, series, interval);

        IndicatorSnapshot snapshot = TechnicalAnalyzer.analyze(series, price);
        SignalScorer.ScoreCard card = SignalScorer.score(snapshot, price, change24h, context.fearGreed());

        log.debug("[Signal] {} {} raw={} conf={} ({} candles, {})",
            quote.assetId(), card.strengthLabel().getDisplay(), card.rawScore(), card.confidence(),
            series.size(), interval.getCode());

        return new Signal(
            normalize(quote.assetId()),
            card.action(),
            card.strengthLabel(),
            card.displayScore(),
            card.rawScore(),
            card.confidence(),
            price,
            change24h,
            card.reasons(),
            snapshot,
            interval.getCode(),
            series.size(),
            dataSource,
            Instant.now(clock)
        );
    }

    /**
     * Degraded HOLD used when there is too little history, or when the candle
     * fetch failed altogether.
     */
    public Signal insufficient(AssetQuote quote, List<Candle> candles, CandleInterval interval) {
        double price = resolvePrice(quote, candles);
        double change24h = quote.change24h() != null ? quote.change24h() : 0;

        return new Signal(
            normalize(quote.assetId()),
            SignalAction.HOLD,
            StrengthLabel.HOLD,
            50,
            0,
            15,
            price,
            change24h,
            List.of(INSUFFICIENT_REASON),
            IndicatorSnapshot.insufficient(price),
            interval.getCode(),
            candles.size(),
            Signal.INSUFFICIENT,
            Instant.now(clock)
        );
    }

    static double resolvePrice(AssetQuote quote, List<Candle> candles) {
        if (quote.price() != null) {
            return quote.price();
        }
        return candles.isEmpty() ? 0 : CandleSeries.last(candles).close();
    }

    /**
     * Quote value when present, else the close-to-close return (%) over one
     * day's worth of candles, else 0.
     */
    static double resolveChange24h(AssetQuote quote, List<Candle> candles, CandleInterval interval) {
        if (quote.change24h() != null) {
            return quote.change24h();
        }
        int perDay = interval.candlesPerDay();
        if (candles.size() <= perDay) {
            return 0;
        }
        double latest = CandleSeries.last(candles).close();
        double dayAgo = candles.get(candles.size() - 1 - perDay).close();
        return dayAgo != 0 ? (latest - dayAgo) / dayAgo * 100 : 0;
    }

    private static String normalize(String assetId) {
        return assetId.toUpperCase(Locale.ROOT);
    }
}
