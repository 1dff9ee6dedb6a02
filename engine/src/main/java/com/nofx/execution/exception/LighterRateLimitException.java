package com.nofx.execution.exception;

public class LighterRateLimitException extends LighterApiException {
    public LighterRateLimitException(String message, Throwable cause) {
        super(message, 429, cause);
    }
}
