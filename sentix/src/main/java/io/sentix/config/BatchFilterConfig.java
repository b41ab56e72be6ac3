package io.sentix.config;

import io.sentix.util.Env;

/**
 * Batch filtering thresholds.
 *
 * The confidence floor keeps actionable (BUY / SELL) signals only. The critical
 * filter is stricter and per action: BUY needs rawScore ≥ buyMinRawScore,
 * SELL needs rawScore ≤ -sellMinRawScore.
 */
public record BatchFilterConfig(
    int minConfidence,          // floor for the actionable list (e.g., 60)
    int buyMinConfidence,       // critical BUY confidence
    int buyMinRawScore,         // critical BUY rawScore (positive)
    int sellMinConfidence,      // critical SELL confidence
    int sellMinRawScore         // critical SELL |rawScore| (positive)
) {
    /**
     * Default configuration: floor 60, critical at confidence 60 and |rawScore| 35.
     */
    public static BatchFilterConfig defaults() {
        return new BatchFilterConfig(60, 60, 35, 60, 35);
    }

    /**
     * Defaults overridden by SENTIX_MIN_CONFIDENCE, SENTIX_CRITICAL_BUY_CONFIDENCE,
     * SENTIX_CRITICAL_BUY_RAW_SCORE, SENTIX_CRITICAL_SELL_CONFIDENCE and
     * SENTIX_CRITICAL_SELL_RAW_SCORE.
     */
    public static BatchFilterConfig fromEnv() {
        BatchFilterConfig d = defaults();
        return new BatchFilterConfig(
            Env.getInt("SENTIX_MIN_CONFIDENCE", d.minConfidence()),
            Env.getInt("SENTIX_CRITICAL_BUY_CONFIDENCE", d.buyMinConfidence()),
            Env.getInt("SENTIX_CRITICAL_BUY_RAW_SCORE", d.buyMinRawScore()),
            Env.getInt("SENTIX_CRITICAL_SELL_CONFIDENCE", d.sellMinConfidence()),
            Env.getInt("SENTIX_CRITICAL_SELL_RAW_SCORE", d.sellMinRawScore())
        );
    }

    /**
     * Validate configuration values.
     */
    public boolean isValid() {
        return minConfidence >= 0 && minConfidence <= 100
            && buyMinConfidence >= 0 && buyMinConfidence <= 100
            && sellMinConfidence >= 0 && sellMinConfidence <= 100
            && buyMinRawScore >= 0 && buyMinRawScore <= 100
            && sellMinRawScore >= 0 && sellMinRawScore <= 100;
    }
}
