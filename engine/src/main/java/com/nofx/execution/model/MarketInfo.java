package com.nofx.execution.model;

/**
 * Exchange metadata for one perpetual market, keyed by coin ("ETH", "BTC").
 */
public record MarketInfo(
        String coin,
        int marketIndex,
        int sizeDecimals,
        int priceDecimals
) {
    public MarketInfo {
        if (coin == null || coin.isBlank()) {
            throw new IllegalArgumentException("coin is required");
        }
        if (sizeDecimals < 0 || priceDecimals < 0) {
            throw new IllegalArgumentException("decimals must be >= 0 for " + coin);
        }
    }
}
