package com.nofx.execution.model;

import java.math.BigDecimal;

/**
 * Open position projected from an account snapshot.
 *
 * @param amount   always positive; direction is carried by {@code side}
 * @param leverage null when the exchange reports a non-positive margin fraction
 */
public record Position(
        String symbol,
        PositionSide side,
        BigDecimal amount,
        BigDecimal entryPrice,
        BigDecimal markPrice,
        BigDecimal unrealizedPnl,
        BigDecimal liquidationPrice,
        BigDecimal leverage
) {}
