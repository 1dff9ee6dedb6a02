package com.nofx.execution.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fully encoded order handed to the signer. Prices and sizes are already in
 * the exchange's integer units.
 */
@Value
@Builder
public class OrderIntent {

    String symbol;
    int marketIndex;
    long clientOrderIndex;
    long rawQuantity;
    long limitPrice;
    boolean ask;
    boolean reduceOnly;
    OrderType orderType;
    TimeInForce timeInForce;

    // null when the order has no trigger
    Long triggerPrice;

    // epoch millis, null for orders without expiry
    Long expiry;
}
