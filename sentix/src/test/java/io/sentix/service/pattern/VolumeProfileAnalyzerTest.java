package io.sentix.service.pattern;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleFixtures;
import io.sentix.domain.indicator.VolumeProfile;
import io.sentix.domain.indicator.VolumeProfile.ProfileType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for VolumeProfileAnalyzer.
 */
class VolumeProfileAnalyzerTest {

    /**
     * 14 candles at volume 100, then 14 candles stepping by step at the given volume.
     */
    private static List<Candle> series(double step, double recentVolume) {
        List<Candle> candles = new ArrayList<>();
        double close = 100;
        for (int i = 0; i < 14; i++) {
            candles.add(CandleFixtures.candle(i, close, close, 100));
        }
        for (int i = 14; i < 28; i++) {
            double next = close + step;
            candles.add(CandleFixtures.candle(i, close, next, recentVolume));
            close = next;
        }
        return candles;
    }

    @Test
    void testRisingVolumeConfirmsUpMove() {
        VolumeProfile profile = VolumeProfileAnalyzer.analyze(series(1, 200));

        assertEquals(ProfileType.CONFIRMING_UP, profile.profile());
        assertEquals(2.0, profile.ratio(), 1e-9);
        assertEquals(100, profile.buyPressure());
    }

    @Test
    void testRisingVolumeConfirmsDownMove() {
        VolumeProfile profile = VolumeProfileAnalyzer.analyze(series(-1, 200));

        assertEquals(ProfileType.CONFIRMING_DOWN, profile.profile());
        assertEquals(0, profile.buyPressure());
    }

    @Test
    void testSteadyVolumeIsNeutral() {
        VolumeProfile profile = VolumeProfileAnalyzer.analyze(series(1, 100));

        assertEquals(ProfileType.NEUTRAL, profile.profile(), "Ratio 1.0 does not confirm");
        assertEquals(1.0, profile.ratio(), 1e-9);
    }

    @Test
    void testPriceUpOnSellingVolumeDiverges() {
        // Every candle closes below its open, yet each opens higher than the last close
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            double close = 100 + i;
            candles.add(Candle.of(i, close + 0.5, close + 1, close - 1, close, 100));
        }

        VolumeProfile profile = VolumeProfileAnalyzer.analyze(candles);
        assertEquals(ProfileType.DIVERGING, profile.profile());
        assertEquals(0, profile.buyPressure());
    }

    @Test
    void testPartialOlderWindow() {
        // 20 candles: the older window holds only 6
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            candles.add(CandleFixtures.candle(i, 100, 100, 50));
        }
        for (int i = 6; i < 20; i++) {
            candles.add(CandleFixtures.candle(i, 100, 100, 100));
        }
        assertEquals(2.0, VolumeProfileAnalyzer.analyze(candles).ratio(), 1e-9);
    }

    @Test
    void testInsufficientData() {
        VolumeProfile profile = VolumeProfileAnalyzer.analyze(CandleFixtures.flat(14, 100));

        assertFalse(profile.sufficient());
        assertEquals(ProfileType.NEUTRAL, profile.profile());
        assertEquals(50, profile.buyPressure());
        assertEquals(1.0, profile.ratio());
    }
}
