package io.sentix.service.batch;

import io.sentix.domain.signal.Signal;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one batch run.
 *
 * all        - one signal per requested asset, input order
 * actionable - BUY / SELL at or above the confidence floor, by confidence descending
 * critical   - subset of actionable passing the per-action critical thresholds
 */
public record BatchResult(
    List<Signal> all,
    List<Signal> actionable,
    List<Signal> critical,
    Duration duration
) {
    public BatchResult {
        all = List.copyOf(all);
        actionable = List.copyOf(actionable);
        critical = List.copyOf(critical);
    }

    /**
     * Signals that fell back to the insufficient-data HOLD.
     */
    public long degradedCount() {
        return all.stream().filter(s -> !s.hasSufficientData()).count();
    }
}
