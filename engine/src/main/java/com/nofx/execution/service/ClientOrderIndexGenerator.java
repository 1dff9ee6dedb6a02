package com.nofx.execution.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Millisecond timestamps, bumped by one when two orders land in the same millisecond.
 */
@Component
@RequiredArgsConstructor
public class ClientOrderIndexGenerator {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public long next() {
        long now = clock.millis();
        return last.updateAndGet(previous -> Math.max(previous + 1, now));
    }
}
