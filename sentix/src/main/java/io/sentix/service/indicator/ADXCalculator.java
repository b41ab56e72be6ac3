package io.sentix.service.indicator;

import io.sentix.domain.data.Candle;
import io.sentix.domain.indicator.AdxReading;
import io.sentix.domain.indicator.AdxReading.AdxTrend;

import java.util.List;

/**
 * Average Directional Index with +DI / -DI.
 *
 * TR, +DM and -DM are seeded with their mean over the first period moves and
 * Wilder-smoothed afterwards. DI = smoothed DM / smoothed TR × 100,
 * DX = |+DI - -DI| / (+DI + -DI) × 100, ADX = Wilder-smoothed DX seeded with
 * the mean of the first period DX values.
 *
 * ADX ≥ 25 is a strong trend, ≥ 20 a weak one, below that the market is ranging.
 * Direction comes from the dominant DI.
 */
public final class ADXCalculator {

    public static final int DEFAULT_PERIOD = 14;

    private static final double STRONG_THRESHOLD = 25;
    private static final double WEAK_THRESHOLD = 20;

    private ADXCalculator() {
    }

    public static AdxReading calculate(List<Candle> candles) {
        return calculate(candles, DEFAULT_PERIOD);
    }

    public static AdxReading calculate(List<Candle> candles, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("ADX period must be positive: " + period);
        }
        if (candles.size() < period + 2) {
            return AdxReading.insufficient();
        }

        int moves = candles.size() - 1;
        double[] trueRanges = new double[moves];
        double[] plusDMs = new double[moves];
        double[] minusDMs = new double[moves];

        for (int i = 1; i < candles.size(); i++) {
            Candle current = candles.get(i);
            Candle previous = candles.get(i - 1);

            trueRanges[i - 1] = current.trueRange(previous);

            double upMove = current.high() - previous.high();
            double downMove = previous.low() - current.low();
            plusDMs[i - 1] = upMove > downMove && upMove > 0 ? upMove : 0;
            minusDMs[i - 1] = downMove > upMove && downMove > 0 ? downMove : 0;
        }

        double atr = seed(trueRanges, period);
        double smoothPlusDM = seed(plusDMs, period);
        double smoothMinusDM = seed(minusDMs, period);

        int dxCount = moves - period;
        if (dxCount < period) {
            return AdxReading.insufficient();
        }

        double[] dxValues = new double[dxCount];
        double plusDI = 0;
        double minusDI = 0;

        for (int i = period; i < moves; i++) {
            atr = wilder(atr, trueRanges[i], period);
            smoothPlusDM = wilder(smoothPlusDM, plusDMs[i], period);
            smoothMinusDM = wilder(smoothMinusDM, minusDMs[i], period);

            plusDI = atr > 0 ? smoothPlusDM / atr * 100 : 0;
            minusDI = atr > 0 ? smoothMinusDM / atr * 100 : 0;
            double diSum = plusDI + minusDI;
            dxValues[i - period] = diSum > 0 ? Math.abs(plusDI - minusDI) / diSum * 100 : 0;
        }

        double adx = seed(dxValues, period);
        for (int i = period; i < dxCount; i++) {
            adx = wilder(adx, dxValues[i], period);
        }

        return new AdxReading(round1(adx), round1(plusDI), round1(minusDI), trend(adx, plusDI, minusDI), true);
    }

    private static AdxTrend trend(double adx, double plusDI, double minusDI) {
        boolean up = plusDI > minusDI;
        if (adx >= STRONG_THRESHOLD) {
            return up ? AdxTrend.STRONG_UP : AdxTrend.STRONG_DOWN;
        }
        if (adx >= WEAK_THRESHOLD) {
            return up ? AdxTrend.WEAK_UP : AdxTrend.WEAK_DOWN;
        }
        return AdxTrend.RANGING;
    }

    private static double seed(double[] values, int period) {
        double sum = 0;
        for (int i = 0; i < period; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    // avg_t = (avg_{t-1} × (n-1) + x_t) / n
    private static double wilder(double previous, double value, int period) {
        return (previous * (period - 1) + value) / period;
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
