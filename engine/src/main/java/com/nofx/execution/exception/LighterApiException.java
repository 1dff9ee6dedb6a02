package com.nofx.execution.exception;

public class LighterApiException extends RuntimeException {
    private final int statusCode;

    public LighterApiException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public LighterApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public LighterApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
