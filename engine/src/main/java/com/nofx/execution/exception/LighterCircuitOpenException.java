package com.nofx.execution.exception;

public class LighterCircuitOpenException extends LighterApiException {
    public LighterCircuitOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
