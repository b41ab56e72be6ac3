package io.sentix.domain.data;

import java.time.Duration;

/**
 * Candle interval (Binance kline codes).
 */
public enum CandleInterval {
    MINUTE_1("1m", Duration.ofMinutes(1)),
    MINUTE_3("3m", Duration.ofMinutes(3)),
    MINUTE_5("5m", Duration.ofMinutes(5)),
    MINUTE_15("15m", Duration.ofMinutes(15)),
    MINUTE_30("30m", Duration.ofMinutes(30)),
    HOUR_1("1h", Duration.ofHours(1)),
    HOUR_2("2h", Duration.ofHours(2)),
    HOUR_4("4h", Duration.ofHours(4)),
    HOUR_6("6h", Duration.ofHours(6)),
    HOUR_8("8h", Duration.ofHours(8)),
    HOUR_12("12h", Duration.ofHours(12)),
    DAY_1("1d", Duration.ofDays(1)),
    DAY_3("3d", Duration.ofDays(3)),
    WEEK_1("1w", Duration.ofDays(7)),
    MONTH_1("1M", Duration.ofDays(30));

    private final String code;
    private final Duration duration;

    CandleInterval(String code, Duration duration) {
        this.code = code;
        this.duration = duration;
    }

    public String getCode() {
        return code;
    }

    public Duration getDuration() {
        return duration;
    }

    public boolean isMinuteBased() {
        return code.endsWith("m");
    }

    /**
     * Default number of candles to request: 1h → 200 (a bit over 8 days),
     * minute intervals → 288, everything else → 100.
     */
    public int defaultLimit() {
        if (this == HOUR_1) return 200;
        if (isMinuteBased()) return 288;
        return 100;
    }

    /**
     * How long a fetched series stays fresh in the candle cache.
     */
    public Duration cacheTtl() {
        return isMinuteBased() ? Duration.ofMinutes(1) : Duration.ofMinutes(5);
    }

    /**
     * Number of candles covering 24 hours (at least 1).
     */
    public int candlesPerDay() {
        long perDay = Duration.ofDays(1).toMillis() / duration.toMillis();
        return (int) Math.max(1, perDay);
    }

    /**
     * Resolve a Binance interval code ("1h", "15m", "1M").
     */
    public static CandleInterval fromCode(String code) {
        for (CandleInterval interval : values()) {
            if (interval.code.equals(code)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Invalid interval: " + code);
    }
}
