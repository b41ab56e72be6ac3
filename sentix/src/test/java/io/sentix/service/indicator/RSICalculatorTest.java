package io.sentix.service.indicator;

import io.sentix.domain.data.CandleFixtures;
import io.sentix.domain.indicator.RsiReading;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RSICalculator (Wilder smoothing).
 */
class RSICalculatorTest {

    @Test
    void testInsufficientDataIsNeutral() {
        RsiReading reading = RSICalculator.calculate(CandleFixtures.linear(14, 100, 1));

        assertFalse(reading.sufficient());
        assertEquals(50.0, reading.value());
    }

    @Test
    void testOnlyGainsGives100() {
        RsiReading reading = RSICalculator.calculate(CandleFixtures.linear(30, 100, 1));

        assertTrue(reading.sufficient());
        assertEquals(100.0, reading.value(), 1e-9);
    }

    @Test
    void testOnlyLossesGives0() {
        RsiReading reading = RSICalculator.calculate(CandleFixtures.linear(30, 100, -1));
        assertEquals(0.0, reading.value(), 1e-9);
    }

    @Test
    void testFlatSeriesGives100() {
        // No losses at all: avgLoss == 0
        RsiReading reading = RSICalculator.calculate(CandleFixtures.linear(20, 100, 0));
        assertEquals(100.0, reading.value(), 1e-9);
    }

    @Test
    void testBalancedMovesGive50() {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            prices.add(i % 2 == 0 ? 10.0 : 11.0);
        }
        assertEquals(50.0, RSICalculator.calculate(prices).value(), 1e-9);
    }

    @Test
    void testSeriesLengthAndRange() {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            prices.add(100 + 10 * Math.sin(i / 3.0));
        }
        List<Double> series = RSICalculator.series(prices);

        assertEquals(60 - 14, series.size(), "Seed value plus one per further delta");
        for (double v : series) {
            assertTrue(v >= 0 && v <= 100, "RSI out of range: " + v);
        }
        assertEquals(series.get(series.size() - 1), RSICalculator.calculate(prices).value());
    }

    @Test
    void testInvalidPeriod() {
        assertThrows(IllegalArgumentException.class, () -> RSICalculator.series(List.of(1.0), 0));
    }
}
