package io.sentix.domain.indicator;

/**
 * Bollinger squeeze: current bandwidth well below its recent average.
 */
public record BollingerSqueeze(
    boolean squeeze,
    SqueezeDirection direction,
    double bandwidth,
    double averageBandwidth,
    boolean sufficient
) {
    public static BollingerSqueeze insufficient() {
        return new BollingerSqueeze(false, SqueezeDirection.NONE, 0, 0, false);
    }

    public enum SqueezeDirection {
        UP,
        DOWN,
        NONE
    }
}
