package io.sentix.service.signal;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleSeries;
import io.sentix.domain.indicator.IndicatorSnapshot;
import io.sentix.service.indicator.ADXCalculator;
import io.sentix.service.indicator.ATRCalculator;
import io.sentix.service.indicator.BollingerBandsCalculator;
import io.sentix.service.indicator.MACDCalculator;
import io.sentix.service.indicator.RSICalculator;
import io.sentix.service.indicator.SupportResistanceCalculator;
import io.sentix.service.pattern.BBSqueezeDetector;
import io.sentix.service.pattern.EMATrendDetector;
import io.sentix.service.pattern.RSIDivergenceDetector;
import io.sentix.service.pattern.VolumeProfileAnalyzer;

import java.util.List;

/**
 * Runs every indicator and pattern detector over one candle series.
 */
public final class TechnicalAnalyzer {

    private TechnicalAnalyzer() {
    }

    /**
     * @param candles Candles oldest first
     * @param price   Current price, used for ATR %
     */
    public static IndicatorSnapshot analyze(List<Candle> candles, double price) {
        List<Double> closes = CandleSeries.closes(candles);
        List<Double> rsiSeries = RSICalculator.series(closes);
        double atr = ATRCalculator.calculate(candles);

        return new IndicatorSnapshot(
            RSICalculator.calculate(closes),
            rsiSeries,
            MACDCalculator.calculate(closes),
            BollingerBandsCalculator.calculate(closes),
            ADXCalculator.calculate(candles),
            EMATrendDetector.detect(closes),
            RSIDivergenceDetector.detect(closes, rsiSeries),
            VolumeProfileAnalyzer.analyze(candles),
            BBSqueezeDetector.detect(closes),
            atr,
            ATRCalculator.percentOf(atr, price),
            SupportResistanceCalculator.calculate(candles)
        );
    }
}
