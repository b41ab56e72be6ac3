package io.sentix.service.indicator;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MovingAverages.
 *
 * Tests:
 * - SMA sliding window
 * - EMA seeding and smoothing
 * - Short series and invalid periods
 */
class MovingAveragesTest {

    private static final List<Double> ONE_TO_FIVE = List.of(1.0, 2.0, 3.0, 4.0, 5.0);

    @Test
    void testSma() {
        assertEquals(List.of(2.0, 3.0, 4.0), MovingAverages.sma(ONE_TO_FIVE, 3));
        assertTrue(MovingAverages.sma(ONE_TO_FIVE, 6).isEmpty(), "Series shorter than period");
    }

    @Test
    void testEmaSeededWithSma() {
        // k = 0.5: seed 2, then 4×0.5 + 2×0.5 = 3, then 5×0.5 + 3×0.5 = 4
        List<Double> ema = MovingAverages.ema(ONE_TO_FIVE, 3);

        assertEquals(3, ema.size());
        assertEquals(2.0, ema.get(0), 1e-12);
        assertEquals(3.0, ema.get(1), 1e-12);
        assertEquals(4.0, ema.get(2), 1e-12);
    }

    @Test
    void testEmaShortSeries() {
        assertTrue(MovingAverages.ema(List.of(1.0, 2.0), 3).isEmpty());
        assertEquals(List.of(7.0), MovingAverages.ema(List.of(7.0), 26), "Single value returns itself");
        assertEquals(0.0, MovingAverages.lastEma(List.of(1.0, 2.0), 9));
        assertEquals(4.0, MovingAverages.lastEma(ONE_TO_FIVE, 3), 1e-12);
    }

    @Test
    void testInvalidPeriod() {
        assertThrows(IllegalArgumentException.class, () -> MovingAverages.sma(ONE_TO_FIVE, 0));
        assertThrows(IllegalArgumentException.class, () -> MovingAverages.ema(ONE_TO_FIVE, -1));
    }

    @Test
    void testMeanAndStdDev() {
        List<Double> values = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);
        double mean = MovingAverages.mean(values);

        assertEquals(5.0, mean, 1e-12);
        assertEquals(2.0, MovingAverages.populationStdDev(values, mean), 1e-12);
        assertEquals(0.0, MovingAverages.mean(List.of()));
    }
}
