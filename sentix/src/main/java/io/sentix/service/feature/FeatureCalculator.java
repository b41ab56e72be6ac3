package io.sentix.service.feature;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleInterval;
import io.sentix.domain.data.CandleSeries;
import io.sentix.domain.feature.MarketFeatures;
import io.sentix.domain.feature.MarketRegime;
import io.sentix.service.indicator.ATRCalculator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Feature Calculator - derived market features from a candle series.
 *
 * All periods and windows are counted in candles. Every calculation returns 0
 * when there are not enough candles.
 */
public final class FeatureCalculator {

    public static final int MIN_CANDLES = 50;

    private static final int REGIME_WINDOW = 50;
    private static final double VOLATILE_THRESHOLD = 0.03;
    private static final double DRIFT_THRESHOLD = 0.001;

    private FeatureCalculator() {
    }

    /**
     * Close-to-close return (%) over the given number of periods.
     */
    public static double calculateReturn(List<Candle> candles, int periods) {
        if (candles.size() < periods + 1) {
            return 0;
        }
        double latest = candles.get(candles.size() - 1).close();
        double previous = candles.get(candles.size() - 1 - periods).close();
        return previous != 0 ? (latest - previous) / previous * 100 : 0;
    }

    /**
     * Population standard deviation of the window's percentage returns.
     */
    public static double calculateRealizedVolatility(List<Candle> candles, int window) {
        if (candles.size() < window + 1) {
            return 0;
        }
        List<Double> returns = returns(CandleSeries.tail(candles, window + 1), 100);
        return stdDev(returns);
    }

    /**
     * How unusual the last candle's volume is against the trailing window + 1 volumes.
     */
    public static double calculateVolumeZScore(List<Candle> candles, int window) {
        if (candles.size() < window + 1) {
            return 0;
        }
        List<Double> volumes = new ArrayList<>();
        for (Candle candle : CandleSeries.tail(candles, window + 1)) {
            volumes.add(candle.volume());
        }
        double mean = mean(volumes);
        double sd = stdDev(volumes);
        if (sd == 0) {
            return 0;
        }
        return (CandleSeries.last(candles).volume() - mean) / sd;
    }

    /**
     * Rate of change (%) over the period.
     */
    public static double calculateMomentum(List<Candle> candles, int period) {
        return calculateReturn(candles, period);
    }

    /**
     * Typical-price VWAP over the trailing period.
     */
    public static double calculateVWAP(List<Candle> candles, int period) {
        if (candles.size() < period) {
            return 0;
        }
        double volumeSum = 0;
        double weighted = 0;
        for (Candle candle : CandleSeries.tail(candles, period)) {
            weighted += candle.typicalPrice() * candle.volume();
            volumeSum += candle.volume();
        }
        return volumeSum > 0 ? weighted / volumeSum : 0;
    }

    /**
     * Regime over the last 50 candles: σ of returns above 3% → VOLATILE, mean
     * return above 0.1% → TRENDING_UP, below -0.1% → TRENDING_DOWN, else RANGING.
     */
    public static MarketRegime determineMarketRegime(List<Candle> candles) {
        if (candles.size() < REGIME_WINDOW) {
            return MarketRegime.UNKNOWN;
        }
        List<Double> returns = returns(CandleSeries.tail(candles, REGIME_WINDOW), 1);
        double avgReturn = mean(returns);
        double volatility = stdDev(returns);

        if (volatility > VOLATILE_THRESHOLD) return MarketRegime.VOLATILE;
        if (avgReturn > DRIFT_THRESHOLD) return MarketRegime.TRENDING_UP;
        if (avgReturn < -DRIFT_THRESHOLD) return MarketRegime.TRENDING_DOWN;
        return MarketRegime.RANGING;
    }

    /**
     * Mean volume of the trailing period candles.
     */
    public static double averageVolume(List<Candle> candles, int period) {
        List<Candle> recent = CandleSeries.tail(candles, period);
        if (recent.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (Candle candle : recent) {
            sum += candle.volume();
        }
        return sum / period;
    }

    /**
     * All features, or empty when there are fewer than 50 candles.
     */
    public static Optional<MarketFeatures> compute(List<Candle> candles, CandleInterval interval, Instant computedAt) {
        if (candles.size() < MIN_CANDLES) {
            return Optional.empty();
        }
        Candle latest = CandleSeries.last(candles);
        double avgVolume = averageVolume(candles, 24);

        return Optional.of(new MarketFeatures(
            latest.close(),
            latest.open(),
            latest.high(),
            latest.low(),
            latest.volume(),
            latest.timestamp(),
            calculateReturn(candles, 1),
            calculateReturn(candles, 4),
            calculateReturn(candles, 24),
            calculateReturn(candles, 168),
            calculateRealizedVolatility(candles, 24),
            calculateRealizedVolatility(candles, 168),
            ATRCalculator.calculate(candles, 14),
            calculateVolumeZScore(candles, 24),
            avgVolume,
            avgVolume > 0 ? latest.volume() / avgVolume : 0,
            calculateVWAP(candles, 24),
            calculateMomentum(candles, 14),
            determineMarketRegime(candles),
            interval,
            candles.size(),
            computedAt
        ));
    }

    private static List<Double> returns(List<Candle> window, double scale) {
        List<Double> returns = new ArrayList<>(window.size());
        for (int i = 1; i < window.size(); i++) {
            double prev = window.get(i - 1).close();
            returns.add(prev != 0 ? (window.get(i).close() - prev) / prev * scale : 0);
        }
        return returns;
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return values.isEmpty() ? 0 : sum / values.size();
    }

    private static double stdDev(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double m = mean(values);
        double variance = 0;
        for (double v : values) {
            variance += (v - m) * (v - m);
        }
        return Math.sqrt(variance / values.size());
    }
}
