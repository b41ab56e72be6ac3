package io.sentix.service.indicator;

import io.sentix.domain.data.CandleFixtures;
import io.sentix.domain.indicator.AdxReading;
import io.sentix.domain.indicator.AdxReading.AdxTrend;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ADXCalculator.
 */
class ADXCalculatorTest {

    @Test
    void testNeedsTwoPeriodsOfMoves() {
        // 28 candles: 27 moves leave only 13 DX values for a 14-period ADX
        assertFalse(ADXCalculator.calculate(CandleFixtures.geometric(28, 100, 1.02)).sufficient());
        assertTrue(ADXCalculator.calculate(CandleFixtures.geometric(29, 100, 1.02)).sufficient());
        assertEquals(AdxReading.insufficient(), ADXCalculator.calculate(CandleFixtures.flat(10, 100)));
    }

    @Test
    void testSteadyUptrend() {
        AdxReading reading = ADXCalculator.calculate(CandleFixtures.geometric(100, 100, 1.02));

        assertEquals(100.0, reading.adx(), "Only +DM on every move");
        assertTrue(reading.plusDI() > reading.minusDI());
        assertEquals(0.0, reading.minusDI());
        assertEquals(AdxTrend.STRONG_UP, reading.trend());
    }

    @Test
    void testSteadyDowntrend() {
        AdxReading reading = ADXCalculator.calculate(CandleFixtures.geometric(100, 100, 0.98));

        assertEquals(100.0, reading.adx());
        assertEquals(0.0, reading.plusDI());
        assertEquals(AdxTrend.STRONG_DOWN, reading.trend());
    }

    @Test
    void testFlatMarketIsRanging() {
        AdxReading reading = ADXCalculator.calculate(CandleFixtures.flat(40, 100));

        assertTrue(reading.sufficient());
        assertEquals(0.0, reading.adx());
        assertEquals(AdxTrend.RANGING, reading.trend());
    }

    @Test
    void testValuesRoundedToOneDecimal() {
        AdxReading reading = ADXCalculator.calculate(CandleFixtures.geometric(100, 100, 1.02));
        assertEquals(reading.plusDI(), Math.round(reading.plusDI() * 10) / 10.0);
    }

    @Test
    void testInvalidPeriod() {
        assertThrows(IllegalArgumentException.class,
            () -> ADXCalculator.calculate(CandleFixtures.flat(40, 100), 0));
    }
}
