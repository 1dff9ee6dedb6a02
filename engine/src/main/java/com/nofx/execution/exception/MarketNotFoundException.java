package com.nofx.execution.exception;

public class MarketNotFoundException extends TradingException {
    private final String symbol;

    public MarketNotFoundException(String symbol) {
        super("Market not found for " + symbol);
        this.symbol = symbol;
    }

    public MarketNotFoundException(String symbol, Throwable cause) {
        super("Market not found for " + symbol, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
