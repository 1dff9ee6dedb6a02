package com.nofx.execution.model;

/**
 * What the engine knows about an order it produced. The engine never observes
 * fills, so SUBMITTED is the furthest a successful call gets.
 */
public enum OrderLifecycle {
    SUBMITTED,         // signer accepted it; fill state unknown
    REJECTED,          // refused before sending, or answered with a client error
    UNKNOWN_OUTCOME;   // server error or dropped connection, may have reached the exchange

    public String label() {
        return name().toLowerCase();
    }
}
