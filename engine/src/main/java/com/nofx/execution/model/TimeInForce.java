package com.nofx.execution.model;

/**
 * Workflows only submit immediate-or-cancel orders.
 */
public enum TimeInForce {
    IMMEDIATE_OR_CANCEL
}
