package io.sentix.domain.signal;

/**
 * Market-wide context: Fear & Greed index (0-100) and its label.
 */
public record MacroContext(int fearGreed, String fearLabel) {

    public MacroContext {
        if (fearGreed < 0 || fearGreed > 100) {
            throw new IllegalArgumentException("fearGreed must be within [0, 100]: " + fearGreed);
        }
        if (fearLabel == null) {
            fearLabel = "Neutral";
        }
    }

    public static MacroContext neutral() {
        return new MacroContext(50, "Neutral");
    }
}
