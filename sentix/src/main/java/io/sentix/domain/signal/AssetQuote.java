package io.sentix.domain.signal;

/**
 * Per-asset batch input. Price and 24h change are optional (null) and are then
 * derived from the candle series.
 */
public record AssetQuote(String assetId, Double price, Double change24h) {

    public AssetQuote {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId cannot be blank");
        }
    }

    public static AssetQuote of(String assetId) {
        return new AssetQuote(assetId, null, null);
    }

    public static AssetQuote of(String assetId, double price, double change24h) {
        return new AssetQuote(assetId, price, change24h);
    }
}
