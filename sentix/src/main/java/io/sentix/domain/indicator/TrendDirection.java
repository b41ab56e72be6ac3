package io.sentix.domain.indicator;

/**
 * EMA 9/21/50 alignment classification.
 */
public enum TrendDirection {
    STRONG_UP,
    UP,
    SIDEWAYS,
    DOWN,
    STRONG_DOWN,
    UNKNOWN;

    public boolean isUp() {
        return this == STRONG_UP || this == UP;
    }

    public boolean isDown() {
        return this == STRONG_DOWN || this == DOWN;
    }
}
