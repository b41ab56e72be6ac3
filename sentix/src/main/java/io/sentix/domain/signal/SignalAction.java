package io.sentix.domain.signal;

/**
 * Directional action of a signal.
 */
public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    public boolean isActionable() {
        return this != HOLD;
    }
}
