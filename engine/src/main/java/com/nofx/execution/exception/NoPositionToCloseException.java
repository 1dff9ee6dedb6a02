package com.nofx.execution.exception;

import com.nofx.execution.model.PositionSide;

public class NoPositionToCloseException extends TradingException {
    public NoPositionToCloseException(String symbol, PositionSide side) {
        super("No " + side.name().toLowerCase() + " position to close on " + symbol);
    }
}
