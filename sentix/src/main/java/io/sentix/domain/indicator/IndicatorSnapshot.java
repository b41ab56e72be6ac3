package io.sentix.domain.indicator;

import java.util.List;

/**
 * Every indicator and pattern reading computed for one candle series.
 * This is what the scorer consumes and what a Signal carries for display.
 */
public record IndicatorSnapshot(
    RsiReading rsi,
    List<Double> rsiSeries,
    MacdReading macd,
    BollingerBands bollinger,
    AdxReading adx,
    EmaTrend emaTrend,
    Divergence divergence,
    VolumeProfile volumeProfile,
    BollingerSqueeze squeeze,
    double atr,
    double atrPercent,
    SupportResistance supportResistance
) {
    public IndicatorSnapshot {
        rsiSeries = List.copyOf(rsiSeries);
    }

    /**
     * Snapshot made only of sentinel readings, used for the insufficient-data signal.
     */
    public static IndicatorSnapshot insufficient(double price) {
        return new IndicatorSnapshot(
            RsiReading.insufficient(),
            List.of(),
            MacdReading.insufficient(),
            BollingerBands.insufficient(price),
            AdxReading.insufficient(),
            EmaTrend.unknown(),
            Divergence.none(),
            VolumeProfile.insufficient(),
            BollingerSqueeze.insufficient(),
            0,
            0,
            SupportResistance.insufficient(price)
        );
    }
}
