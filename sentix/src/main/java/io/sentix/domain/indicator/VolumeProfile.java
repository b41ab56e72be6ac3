package io.sentix.domain.indicator;

/**
 * Volume profile: does volume confirm the price move?
 *
 * ratio         = trailing mean volume / preceding mean volume
 * buyPressure   = up-candle share of trailing volume, in percent (rounded)
 */
public record VolumeProfile(
    ProfileType profile,
    double ratio,
    int buyPressure,
    boolean sufficient
) {
    public static VolumeProfile insufficient() {
        return new VolumeProfile(ProfileType.NEUTRAL, 1.0, 50, false);
    }

    public enum ProfileType {
        CONFIRMING_UP,
        CONFIRMING_DOWN,
        DIVERGING,
        NEUTRAL
    }
}
