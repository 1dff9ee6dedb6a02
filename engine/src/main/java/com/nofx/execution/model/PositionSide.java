package com.nofx.execution.model;

public enum PositionSide {
    LONG,
    SHORT;

    /**
     * Side flag of an order that reduces a position on this side: closing a long sells.
     */
    public boolean reducingOrderIsAsk() {
        return this == LONG;
    }
}
