package io.sentix.service.signal;

import io.sentix.domain.indicator.BollingerBands;
import io.sentix.domain.indicator.BollingerSqueeze.SqueezeDirection;
import io.sentix.domain.indicator.Divergence;
import io.sentix.domain.indicator.Divergence.DivergenceType;
import io.sentix.domain.indicator.IndicatorSnapshot;
import io.sentix.domain.indicator.MacdReading;
import io.sentix.domain.indicator.MacdReading.HistogramTrend;
import io.sentix.domain.indicator.SupportResistance;
import io.sentix.domain.indicator.TrendDirection;
import io.sentix.domain.indicator.VolumeProfile;
import io.sentix.domain.indicator.VolumeProfile.ProfileType;
import io.sentix.domain.signal.SignalAction;
import io.sentix.domain.signal.StrengthLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Multi-factor weighted scorer.
 *
 * rawScore is signed (-100 sell .. +100 buy, 0 neutral) and confidence starts
 * at 0; both are built up factor by factor:
 *
 * 1. EMA trend context
 * 2. ADX gate (multiplier 1.2 / 1.0 / 0.6 on the directional factors)
 * 3. RSI with trend context
 * 4. MACD with histogram momentum
 * 5. RSI divergence
 * 6. Bollinger squeeze / %B
 * 7. Volume confirmation (confidence only)
 * 8. Pivot support / resistance
 * 9. 24h momentum
 * 10. Fear &amp; Greed (minor contrarian modifier)
 *
 * followed by an agreement check across six bullish / bearish factors.
 */
public final class SignalScorer {

    public static final int MAX_CONFIDENCE = 85;

    private static final int STRONG_SCORE = 25;
    private static final int LEAN_SCORE = 15;
    private static final int LEAN_CONFIDENCE = 40;

    private SignalScorer() {
    }

    /**
     * Scored outcome for one snapshot.
     */
    public record ScoreCard(
        int rawScore,
        int displayScore,
        int confidence,
        SignalAction action,
        StrengthLabel strengthLabel,
        List<String> reasons
    ) {
        public ScoreCard {
            reasons = List.copyOf(reasons);
        }
    }

    public static ScoreCard score(IndicatorSnapshot snapshot, double price, double change24h, int fearGreed) {
        double score = 0;
        int confidence = 0;
        List<String> reasons = new ArrayList<>();

        TrendDirection trend = snapshot.emaTrend().direction();
        double rsi = snapshot.rsi().value();
        MacdReading macd = snapshot.macd();
        Divergence divergence = snapshot.divergence();
        BollingerBands bollinger = snapshot.bollinger();
        VolumeProfile volume = snapshot.volumeProfile();

        // 1. Trend context
        switch (trend) {
            case STRONG_UP -> {
                score += 20;
                confidence += 15;
                reasons.add("Strong uptrend (EMA 9>21>50)");
            }
            case STRONG_DOWN -> {
                score -= 20;
                confidence += 15;
                reasons.add("Strong downtrend (EMA 9<21<50)");
            }
            case UP -> {
                score += 10;
                confidence += 8;
                reasons.add("Moderate uptrend");
            }
            case DOWN -> {
                score -= 10;
                confidence += 8;
                reasons.add("Moderate downtrend");
            }
            default -> {
                reasons.add("No clear trend (sideways)");
                confidence += 3;
            }
        }

        // 2. ADX gate
        double adx = snapshot.adx().adx();
        double m;
        if (adx >= 30) {
            confidence += 10;
            m = 1.2;
            reasons.add(format("ADX strong trend (%.1f)", adx));
        } else if (adx >= 20) {
            confidence += 5;
            m = 1.0;
        } else {
            m = 0.6;
            reasons.add(format("ADX weak trend (%.1f) - caution", adx));
        }

        // 3. RSI with trend context
        if (rsi < 20) {
            score += 18 * m;
            confidence += 12;
            reasons.add(format("RSI extremely oversold (%.1f)", rsi));
        } else if (rsi < 30) {
            score += 12 * m;
            confidence += 10;
            reasons.add(format("RSI oversold (%.1f)", rsi));
        } else if (rsi < 40) {
            if (trend.isUp()) {
                score += 8 * m;
                confidence += 6;
                reasons.add(format("RSI bullish pullback in uptrend (%.1f)", rsi));
            } else {
                score += 3;
                confidence += 3;
                reasons.add(format("RSI leaning bullish (%.1f)", rsi));
            }
        } else if (rsi > 80) {
            score -= 18 * m;
            confidence += 12;
            reasons.add(format("RSI extremely overbought (%.1f)", rsi));
        } else if (rsi > 70) {
            score -= 12 * m;
            confidence += 10;
            reasons.add(format("RSI overbought (%.1f)", rsi));
        } else if (rsi > 60) {
            if (trend.isDown()) {
                score -= 8 * m;
                confidence += 6;
                reasons.add(format("RSI bearish rally in downtrend (%.1f)", rsi));
            } else {
                score -= 3;
                confidence += 3;
                reasons.add(format("RSI leaning bearish (%.1f)", rsi));
            }
        } else {
            reasons.add(format("RSI neutral (%.1f)", rsi));
            confidence += 2;
        }

        // 4. MACD
        boolean growing = macd.histogramTrend() == HistogramTrend.GROWING;
        boolean shrinking = macd.histogramTrend() == HistogramTrend.SHRINKING;
        if (macd.histogram() > 0 && macd.macd() > macd.signal()) {
            score += (growing ? 15 : 8) * m;
            confidence += growing ? 10 : 6;
            reasons.add(growing ? "MACD bullish crossover (accelerating)" : "MACD bullish (decelerating)");
        } else if (macd.histogram() < 0 && macd.macd() < macd.signal()) {
            score += (shrinking ? -8 : -15) * m;
            confidence += growing ? 6 : 10;
            reasons.add(growing ? "MACD bearish (weakening)" : "MACD bearish crossover (accelerating)");
        } else if (macd.histogram() > 0) {
            score += 4;
            confidence += 3;
        } else if (macd.histogram() < 0) {
            score -= 4;
            confidence += 3;
        }

        // 5. Divergence
        if (divergence.type() == DivergenceType.BULLISH) {
            score += Math.min(20, 10 + divergence.strength());
            confidence += 12;
            reasons.add(format("Bullish RSI divergence detected (strength: %.1f)", divergence.strength()));
        } else if (divergence.type() == DivergenceType.BEARISH) {
            score -= Math.min(20, 10 + divergence.strength());
            confidence += 12;
            reasons.add(format("Bearish RSI divergence detected (strength: %.1f)", divergence.strength()));
        }

        // 6. Bollinger
        if (snapshot.squeeze().squeeze()) {
            confidence += 5;
            if (snapshot.squeeze().direction() == SqueezeDirection.UP) {
                score += 8;
                reasons.add("BB squeeze → breakout likely upward");
            } else {
                score -= 8;
                reasons.add("BB squeeze → breakout likely downward");
            }
        } else if (bollinger.percentB() <= 0) {
            score += 10;
            confidence += 7;
            reasons.add("Price below lower Bollinger Band");
        } else if (bollinger.percentB() >= 1) {
            score -= 10;
            confidence += 7;
            reasons.add("Price above upper Bollinger Band");
        } else if (bollinger.percentB() < 0.2) {
            score += 5;
            confidence += 4;
            reasons.add("Price near lower Bollinger Band");
        } else if (bollinger.percentB() > 0.8) {
            score -= 5;
            confidence += 4;
            reasons.add("Price near upper Bollinger Band");
        }

        // 7. Volume (confidence only)
        if (volume.profile() == ProfileType.CONFIRMING_UP && score > 0) {
            confidence += 10;
            reasons.add("Volume confirms buying (" + volume.buyPressure() + "% buy pressure)");
        } else if (volume.profile() == ProfileType.CONFIRMING_DOWN && score < 0) {
            confidence += 10;
            reasons.add("Volume confirms selling (" + (100 - volume.buyPressure()) + "% sell pressure)");
        } else if (volume.profile() == ProfileType.DIVERGING) {
            confidence -= 8;
            reasons.add("Volume diverges from price - weak signal");
        }

        if (volume.ratio() > 2.0) {
            confidence += 5;
            reasons.add("Unusually high volume");
        } else if (volume.ratio() < 0.5) {
            confidence -= 5;
            reasons.add("Low volume - weak conviction");
        }

        // 8. Support / resistance
        if (price > 0) {
            SupportResistance levels = snapshot.supportResistance();
            double distToSupport = (price - levels.support()) / price;
            double distToResistance = (levels.resistance() - price) / price;
            if (distToSupport < 0.02 && distToSupport > -0.01) {
                score += 8;
                confidence += 5;
                reasons.add("At support level");
            } else if (distToResistance < 0.02 && distToResistance > -0.01) {
                score -= 8;
                confidence += 5;
                reasons.add("At resistance level");
            }
        }

        // 9. 24h momentum
        if (change24h > 10) {
            score += 5;
            confidence += 3;
            reasons.add(format("Strong 24h momentum (+%.1f%%)", change24h));
        } else if (change24h > 5) {
            score += 4;
            confidence += 2;
        } else if (change24h < -10) {
            score -= 5;
            confidence += 3;
            reasons.add(format("Strong 24h selling (%.1f%%)", change24h));
        } else if (change24h < -5) {
            score -= 4;
            confidence += 2;
        }

        // 10. Fear & Greed
        if (fearGreed < 10) {
            score += 3;
            confidence += 3;
            reasons.add("Extreme fear index (" + fearGreed + ") - contrarian");
        } else if (fearGreed < 25) {
            score += 1;
            confidence += 1;
        } else if (fearGreed > 90) {
            score -= 3;
            confidence += 3;
            reasons.add("Extreme greed index (" + fearGreed + ") - caution");
        } else if (fearGreed > 75) {
            score -= 1;
            confidence += 1;
        }

        // Agreement
        int bullish = count(
            trend.isUp(),
            rsi < 45,
            macd.histogram() > 0,
            divergence.type() == DivergenceType.BULLISH,
            bollinger.percentB() < 0.3,
            volume.profile() == ProfileType.CONFIRMING_UP || volume.buyPressure() > 55);
        int bearish = count(
            trend.isDown(),
            rsi > 55,
            macd.histogram() < 0,
            divergence.type() == DivergenceType.BEARISH,
            bollinger.percentB() > 0.7,
            volume.profile() == ProfileType.CONFIRMING_DOWN || volume.buyPressure() < 45);

        if (bullish >= 2 && bearish >= 2) {
            confidence -= 10;
            reasons.add("Mixed signals - conflicting indicators");
        } else if (bullish >= 4 || bearish >= 4) {
            confidence += 10;
            reasons.add(bullish >= 4 ? "Strong multi-factor bullish alignment" : "Strong multi-factor bearish alignment");
        }

        int rawScore = clamp((int) Math.round(score), -100, 100);
        int finalConfidence = clamp(confidence, 0, MAX_CONFIDENCE);
        SignalAction action = resolveAction(rawScore, finalConfidence);

        return new ScoreCard(
            rawScore,
            displayScore(rawScore),
            finalConfidence,
            action,
            StrengthLabel.of(action, rawScore, finalConfidence),
            reasons
        );
    }

    /**
     * BUY when rawScore ≥ 25, or ≥ 15 with confidence ≥ 40. SELL is symmetric.
     */
    public static SignalAction resolveAction(int rawScore, int confidence) {
        if (rawScore >= STRONG_SCORE) return SignalAction.BUY;
        if (rawScore >= LEAN_SCORE && confidence >= LEAN_CONFIDENCE) return SignalAction.BUY;
        if (rawScore <= -STRONG_SCORE) return SignalAction.SELL;
        if (rawScore <= -LEAN_SCORE && confidence >= LEAN_CONFIDENCE) return SignalAction.SELL;
        return SignalAction.HOLD;
    }

    /**
     * Maps -100 .. +100 onto 0 .. 100 (0 → 50).
     */
    public static int displayScore(int rawScore) {
        double shifted = Math.max(0, Math.min(100, (rawScore + 100) / 2.0));
        return (int) Math.round(shifted);
    }

    private static int count(boolean... factors) {
        int n = 0;
        for (boolean factor : factors) {
            if (factor) n++;
        }
        return n;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
