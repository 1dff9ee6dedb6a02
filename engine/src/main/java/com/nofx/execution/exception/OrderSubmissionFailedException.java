package com.nofx.execution.exception;

import com.nofx.execution.model.OrderLifecycle;

public class OrderSubmissionFailedException extends TradingException {
    private final OrderLifecycle lifecycle;

    public OrderSubmissionFailedException(String message, OrderLifecycle lifecycle, Throwable cause) {
        super(message, cause);
        this.lifecycle = lifecycle;
    }

    /**
     * REJECTED when the order certainly did not execute, UNKNOWN_OUTCOME when it may have.
     */
    public OrderLifecycle getLifecycle() {
        return lifecycle;
    }
}
