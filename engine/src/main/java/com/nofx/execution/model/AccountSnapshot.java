package com.nofx.execution.model;

import java.math.BigDecimal;

/**
 * @param walletBalance collateral minus unrealized P&amp;L
 */
public record AccountSnapshot(
        BigDecimal walletBalance,
        BigDecimal availableBalance,
        BigDecimal unrealizedPnl
) {
    public BigDecimal totalEquity() {
        return walletBalance.add(unrealizedPnl);
    }
}
