package com.nofx.execution.model;

import java.util.List;

/**
 * Result of an order workflow. A submitted IOC order may still have expired
 * unfilled; callers confirm fills with a fresh account query.
 *
 * @param warnings best-effort steps that failed without aborting the workflow
 */
public record OrderOutcome(
        long clientOrderIndex,
        String symbol,
        OrderLifecycle lifecycle,
        String submissionHandle,
        List<String> warnings
) {
    public OrderOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String status() {
        return lifecycle.label();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
