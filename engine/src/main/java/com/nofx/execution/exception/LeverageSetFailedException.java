package com.nofx.execution.exception;

public class LeverageSetFailedException extends TradingException {
    public LeverageSetFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
