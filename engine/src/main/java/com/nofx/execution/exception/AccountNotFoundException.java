package com.nofx.execution.exception;

public class AccountNotFoundException extends TradingException {
    public AccountNotFoundException(long accountIndex) {
        super("No account found for index " + accountIndex);
    }
}
