package com.nofx.execution.service.lighter;

import com.nofx.execution.model.MarginMode;
import com.nofx.execution.model.OrderIntent;

/**
 * Signs and sends transactions. Every method returns the transaction hash on acceptance and
 * throws {@link com.nofx.execution.exception.LighterApiException} otherwise. Acceptance says
 * nothing about fills.
 */
public interface TransactionSubmitter {

    String createOrder(OrderIntent intent);

    String cancelAllOrders(String symbol, long timestampMillis);

    /**
     * @param initialMarginFraction in basis points of notional (10000 / leverage)
     */
    String updateLeverage(int marketIndex, int initialMarginFraction, MarginMode marginMode);
}
