package com.nofx.execution.exception;

/**
 * Neither a mark price nor a two-sided book could be read for the market.
 */
public class PriceUnavailableException extends TradingException {
    public PriceUnavailableException(String message) {
        super(message);
    }

    public PriceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
