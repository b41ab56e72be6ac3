package io.sentix.service.candle;

import io.sentix.domain.data.Candle;
import io.sentix.domain.data.CandleFixtures;
import io.sentix.domain.data.CandleInterval;
import io.sentix.infrastructure.provider.ProviderErrorType;
import io.sentix.infrastructure.provider.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CachingCandleProvider.
 *
 * Tests:
 * - Fresh cache hits skip the delegate
 * - A larger limit than the cached fetch refetches
 * - Refetch after TTL
 * - Stale fallback on failure and on empty results
 */
@ExtendWith(MockitoExtension.class)
class CachingCandleProviderTest {

    @Mock
    private CandleProvider delegate;

    private MutableClock clock;
    private InMemoryTtlCache<CandleCacheKey, CachedCandles> cache;
    private CachingCandleProvider provider;

    private final List<Candle> candles = CandleFixtures.flat(100, 100);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        cache = new InMemoryTtlCache<>(clock);
        provider = new CachingCandleProvider(delegate, cache);
    }

    @Test
    void testFreshHitSkipsDelegate() {
        // Arrange
        when(delegate.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100)).thenReturn(candles);

        // Act
        List<Candle> first = provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100);
        List<Candle> second = provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 50);

        // Assert
        assertEquals(100, first.size());
        assertEquals(50, second.size(), "Smaller limit is served from the cached series");
        assertEquals(candles.get(99), second.get(49));
        verify(delegate, times(1)).fetchCandles(eq("bitcoin"), eq(CandleInterval.HOUR_1), anyInt());
    }

    @Test
    void testLargerLimitRefetches() {
        // Arrange
        List<Candle> longSeries = CandleFixtures.flat(200, 100);
        when(delegate.fetchCandles("bitcoin", CandleInterval.HOUR_1, 30)).thenReturn(longSeries.subList(170, 200));
        when(delegate.fetchCandles("bitcoin", CandleInterval.HOUR_1, 200)).thenReturn(longSeries);

        // Act
        List<Candle> small = provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 30);
        List<Candle> large = provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 200);
        List<Candle> medium = provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 50);

        // Assert
        assertEquals(30, small.size());
        assertEquals(200, large.size(), "Entry fetched for 30 candles does not satisfy 200");
        assertEquals(50, medium.size(), "Served from the 200-candle entry");
        assertEquals(longSeries.get(199), medium.get(49));
        verify(delegate).fetchCandles("bitcoin", CandleInterval.HOUR_1, 30);
        verify(delegate).fetchCandles("bitcoin", CandleInterval.HOUR_1, 200);
        verifyNoMoreInteractions(delegate);
    }

    @Test
    void testShortUpstreamSeriesStillCounts() {
        List<Candle> young = CandleFixtures.flat(40, 100);
        when(delegate.fetchCandles("pepe", CandleInterval.HOUR_1, 100)).thenReturn(young);

        provider.fetchCandles("pepe", CandleInterval.HOUR_1, 100);
        List<Candle> again = provider.fetchCandles("pepe", CandleInterval.HOUR_1, 100);

        assertEquals(40, again.size());
        verify(delegate, times(1)).fetchCandles("pepe", CandleInterval.HOUR_1, 100);
    }

    @Test
    void testRefetchAfterTtl() {
        when(delegate.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100)).thenReturn(candles);

        provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100);
        clock.advance(CandleInterval.HOUR_1.cacheTtl());
        provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100);

        verify(delegate, times(2)).fetchCandles("bitcoin", CandleInterval.HOUR_1, 100);
    }

    @Test
    void testIntervalsAreCachedSeparately() {
        when(delegate.fetchCandles(eq("bitcoin"), any(CandleInterval.class), eq(100))).thenReturn(candles);

        provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100);
        provider.fetchCandles("bitcoin", CandleInterval.HOUR_4, 100);

        assertEquals(2, cache.size());
    }

    @Test
    void testFailureServesStaleSeries() {
        when(delegate.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100))
            .thenReturn(candles)
            .thenThrow(new ProviderException("Binance", ProviderErrorType.SERVER_ERROR, "/klines", 503, "down"));

        provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100);
        clock.advance(Duration.ofMinutes(10));

        List<Candle> stale = provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100);
        assertEquals(candles, stale);
    }

    @Test
    void testFailureWithoutCachePropagates() {
        ProviderException failure =
            new ProviderException("Binance", ProviderErrorType.TIMEOUT, "/klines", null, "slow");
        when(delegate.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100)).thenThrow(failure);

        ProviderException thrown = assertThrows(ProviderException.class,
            () -> provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100));
        assertSame(failure, thrown);
    }

    @Test
    void testEmptyResultServesStaleOrEmpty() {
        when(delegate.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100))
            .thenReturn(candles)
            .thenReturn(List.of());
        when(delegate.fetchCandles("solana", CandleInterval.HOUR_1, 100)).thenReturn(List.of());

        provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100);
        clock.advance(Duration.ofMinutes(10));

        assertEquals(100, provider.fetchCandles("bitcoin", CandleInterval.HOUR_1, 100).size());
        assertTrue(provider.fetchCandles("solana", CandleInterval.HOUR_1, 100).isEmpty());
        assertTrue(cache.getStale(new CandleCacheKey("solana", CandleInterval.HOUR_1)).isEmpty(),
            "Empty results are never cached");
    }

    @Test
    void testDataSourceDelegates() {
        when(delegate.getDataSource()).thenReturn("BINANCE_OHLCV");
        when(delegate.dataSourceFor("bitcoin")).thenReturn("COINGECKO_DAILY");

        assertEquals("BINANCE_OHLCV", provider.getDataSource());
        assertEquals("COINGECKO_DAILY", provider.dataSourceFor("bitcoin"));
    }
}
