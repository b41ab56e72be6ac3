package io.sentix.service.signal;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleFixtures;
import io.sentix.domain.indicator.IndicatorSnapshot;
import io.sentix.domain.indicator.VolumeProfile.ProfileType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TechnicalAnalyzer.
 */
class TechnicalAnalyzerTest {

    @Test
    void testSnapshotOverUptrend() {
        List<Candle> candles = CandleFixtures.geometric(100, 100, 1.02);
        double price = candles.get(99).close();

        IndicatorSnapshot snapshot = TechnicalAnalyzer.analyze(candles, price);

        assertTrue(snapshot.rsi().sufficient());
        assertEquals(100 - 14, snapshot.rsiSeries().size());
        assertTrue(snapshot.macd().sufficient());
        assertTrue(snapshot.bollinger().sufficient());
        assertTrue(snapshot.adx().sufficient());
        assertTrue(snapshot.emaTrend().sufficient());
        assertTrue(snapshot.squeeze().sufficient());
        assertTrue(snapshot.supportResistance().sufficient());
        assertEquals(ProfileType.NEUTRAL, snapshot.volumeProfile().profile(), "Constant volume never confirms");
        assertEquals(100, snapshot.volumeProfile().buyPressure());
        assertTrue(snapshot.atr() > 0);
        assertEquals(snapshot.atr() / price * 100, snapshot.atrPercent(), 1e-9);
    }

    @Test
    void testSnapshotOverFlatMarket() {
        IndicatorSnapshot snapshot = TechnicalAnalyzer.analyze(CandleFixtures.flat(60, 100), 100);

        assertEquals(100.0, snapshot.rsi().value(), 1e-9);
        assertEquals(0.0, snapshot.bollinger().bandwidth());
        assertEquals(100.0, snapshot.supportResistance().pivot(), 1e-9);
        assertEquals(1.0, snapshot.atrPercent(), 1e-9);
    }

    @Test
    void testInsufficientSnapshotSentinels() {
        IndicatorSnapshot snapshot = IndicatorSnapshot.insufficient(200);

        assertEquals(50.0, snapshot.rsi().value());
        assertEquals(0.5, snapshot.bollinger().percentB());
        assertEquals(190.0, snapshot.supportResistance().support(), 1e-9);
        assertTrue(snapshot.rsiSeries().isEmpty());
    }
}
