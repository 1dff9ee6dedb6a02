package com.nofx.execution.model;

public enum MarginMode {
    CROSS(0),
    ISOLATED(1);

    private final int wireValue;

    MarginMode(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }
}
