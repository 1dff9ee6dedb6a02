package com.nofx.execution.model;

public enum OrderType {
    LIMIT,
    STOP_LOSS,
    TAKE_PROFIT
}
