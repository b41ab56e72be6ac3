package io.sentix.service.pattern;

import io.sentix.domain.indicator.EmaTrend;
import io.sentix.domain.indicator.TrendDirection;
import io.sentix.service.indicator.MovingAverages;

import java.util.List;

/**
 * EMA 9 / 21 / 50 alignment.
 *
 * STRONG_UP:   price > EMA9 > EMA21 > EMA50, strength = min(10 × (EMA9 - EMA50) / EMA50 × 100, 100)
 * STRONG_DOWN: price < EMA9 < EMA21 < EMA50, symmetric
 * UP:          price > EMA21 and EMA9 > EMA21 (strength 50)
 * DOWN:        price < EMA21 and EMA9 < EMA21 (strength 50)
 * SIDEWAYS:    anything else (strength 20)
 */
public final class EMATrendDetector {

    public static final int MIN_PRICES = 50;

    private EMATrendDetector() {
    }

    public static EmaTrend detect(List<Double> prices) {
        if (prices.size() < MIN_PRICES) {
            return EmaTrend.unknown();
        }

        double e9 = MovingAverages.lastEma(prices, 9);
        double e21 = MovingAverages.lastEma(prices, 21);
        double e50 = MovingAverages.lastEma(prices, 50);
        double price = prices.get(prices.size() - 1);

        if (price > e9 && e9 > e21 && e21 > e50) {
            double separation = (e9 - e50) / e50 * 100;
            return new EmaTrend(TrendDirection.STRONG_UP, Math.min(separation * 10, 100), e9, e21, e50);
        }
        if (price < e9 && e9 < e21 && e21 < e50) {
            double separation = (e50 - e9) / e50 * 100;
            return new EmaTrend(TrendDirection.STRONG_DOWN, Math.min(separation * 10, 100), e9, e21, e50);
        }
        if (price > e21 && e9 > e21) {
            return new EmaTrend(TrendDirection.UP, 50, e9, e21, e50);
        }
        if (price < e21 && e9 < e21) {
            return new EmaTrend(TrendDirection.DOWN, 50, e9, e21, e50);
        }
        return new EmaTrend(TrendDirection.SIDEWAYS, 20, e9, e21, e50);
    }
}
