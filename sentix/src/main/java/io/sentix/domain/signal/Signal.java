package io.sentix.domain.signal;

import io.sentix.domain.indicator.IndicatorSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Classification result for one asset.
 *
 * score is the display value (0-100, 50 = neutral); rawScore is the signed
 * internal score (-100..100) that drives the action. dataSource names the
 * candle feed ("BINANCE_OHLCV") or {@link #INSUFFICIENT} for the degraded path.
 */
public record Signal(
    String asset,
    SignalAction action,
    StrengthLabel strengthLabel,
    int score,
    int rawScore,
    int confidence,
    double price,
    double change24h,
    List<String> reasons,
    IndicatorSnapshot indicators,
    String interval,
    int candlesAnalyzed,
    String dataSource,
    Instant timestamp
) {
    public static final String INSUFFICIENT = "INSUFFICIENT";

    public Signal {
        reasons = List.copyOf(reasons);
    }

    public boolean hasSufficientData() {
        return !INSUFFICIENT.equals(dataSource);
    }

    public boolean isActionable() {
        return action.isActionable();
    }

    /**
     * Reasons joined for one-line display.
     */
    public String reasonSummary() {
        return String.join(" • ", reasons);
    }
}
