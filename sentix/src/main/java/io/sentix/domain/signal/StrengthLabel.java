package io.sentix.domain.signal;

/**
 * Human-facing strength label derived from action, |rawScore| and confidence.
 */
public enum StrengthLabel {
    STRONG_BUY("STRONG BUY"),
    BUY("BUY"),
    WEAK_BUY("WEAK BUY"),
    HOLD("HOLD"),
    WEAK_SELL("WEAK SELL"),
    SELL("SELL"),
    STRONG_SELL("STRONG SELL");

    private final String display;

    StrengthLabel(String display) {
        this.display = display;
    }

    public String getDisplay() {
        return display;
    }

    /**
     * STRONG needs |rawScore| ≥ 50 and confidence ≥ 60, plain needs 35 / 45,
     * anything else actionable is WEAK.
     */
    public static StrengthLabel of(SignalAction action, int rawScore, int confidence) {
        return switch (action) {
            case BUY -> {
                if (rawScore >= 50 && confidence >= 60) yield STRONG_BUY;
                if (rawScore >= 35 && confidence >= 45) yield BUY;
                yield WEAK_BUY;
            }
            case SELL -> {
                if (rawScore <= -50 && confidence >= 60) yield STRONG_SELL;
                if (rawScore <= -35 && confidence >= 45) yield SELL;
                yield WEAK_SELL;
            }
            case HOLD -> HOLD;
        };
    }
}
