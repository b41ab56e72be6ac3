package io.sentix.service.pattern;

import io.sentix.domain.data.Candle;
import io.sentix.domain.indicator.VolumeProfile;
import io.sentix.domain.indicator.VolumeProfile.ProfileType;

import java.util.List;

/**
 * Checks whether volume confirms the recent price move.
 *
 * The trailing lookback candles are compared with the window just before them
 * (or whatever part of it exists). Buy pressure is the up-candle share of the
 * trailing volume.
 */
public final class VolumeProfileAnalyzer {

    public static final int DEFAULT_LOOKBACK = 14;

    private static final double BUY_DOMINANT = 0.55;
    private static final double SELL_DOMINANT = 0.45;
    private static final double RISING_VOLUME = 1.1;

    private VolumeProfileAnalyzer() {
    }

    public static VolumeProfile analyze(List<Candle> candles) {
        return analyze(candles, DEFAULT_LOOKBACK);
    }

    public static VolumeProfile analyze(List<Candle> candles, int lookback) {
        if (lookback <= 0) {
            throw new IllegalArgumentException("Volume lookback must be positive: " + lookback);
        }
        if (candles.size() < lookback + 1) {
            return VolumeProfile.insufficient();
        }

        int size = candles.size();
        List<Candle> recent = candles.subList(size - lookback, size);
        List<Candle> older = candles.subList(Math.max(0, size - 2 * lookback), size - lookback);

        double recentAvg = averageVolume(recent);
        double olderAvg = averageVolume(older);
        double ratio = olderAvg > 0 ? recentAvg / olderAvg : 1;

        double firstClose = recent.get(0).close();
        double priceChange = recent.get(recent.size() - 1).close() - firstClose;

        double upVolume = 0;
        double downVolume = 0;
        for (Candle candle : recent) {
            if (candle.isUp()) {
                upVolume += candle.volume();
            } else {
                downVolume += candle.volume();
            }
        }
        double total = upVolume + downVolume;
        double buyPressure = total > 0 ? upVolume / total : 0.5;

        ProfileType profile = ProfileType.NEUTRAL;
        if (priceChange > 0 && buyPressure > BUY_DOMINANT && ratio > RISING_VOLUME) {
            profile = ProfileType.CONFIRMING_UP;
        } else if (priceChange < 0 && buyPressure < SELL_DOMINANT && ratio > RISING_VOLUME) {
            profile = ProfileType.CONFIRMING_DOWN;
        } else if (priceChange > 0 && buyPressure < SELL_DOMINANT) {
            profile = ProfileType.DIVERGING;
        } else if (priceChange < 0 && buyPressure > BUY_DOMINANT) {
            profile = ProfileType.DIVERGING;
        }

        return new VolumeProfile(profile, ratio, (int) Math.round(buyPressure * 100), true);
    }

    private static double averageVolume(List<Candle> candles) {
        if (candles.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (Candle candle : candles) {
            sum += candle.volume();
        }
        return sum / candles.size();
    }
}
