package com.nofx.execution.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong ordersSubmitted = new AtomicLong();
    private final AtomicLong exchangeFailures = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> failuresByReason = new ConcurrentHashMap<>();

    private Counter bestEffortWarningsCounter;
    private Counter exchangeErrorsCounter;

    @PostConstruct
    void init() {
        bestEffortWarningsCounter = Counter.builder("lighter_best_effort_warnings_total").register(meterRegistry);
        exchangeErrorsCounter = Counter.builder("lighter_exchange_errors_total").register(meterRegistry);
    }

    public void recordOrderSubmitted(String type) {
        ordersSubmitted.incrementAndGet();
        Counter.builder("lighter_orders_submitted_total")
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    public void recordOrderFailure(String reason) {
        failuresByReason.computeIfAbsent(reason, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("lighter_order_failures_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordBestEffortWarning() {
        if (bestEffortWarningsCounter != null) {
            bestEffortWarningsCounter.increment();
        }
    }

    public void incrementExchangeFailures() {
        exchangeFailures.incrementAndGet();
        if (exchangeErrorsCounter != null) {
            exchangeErrorsCounter.increment();
        }
    }

    public void recordMetadataReload(boolean success, int markets) {
        Counter.builder("lighter_metadata_reloads_total")
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
        if (success) {
            log.debug("Market metadata reloaded with {} markets", markets);
        }
    }

    public long getOrdersSubmitted() {
        return ordersSubmitted.get();
    }

    public long getExchangeFailures() {
        return exchangeFailures.get();
    }

    public Map<String, Long> getFailuresByReason() {
        Map<String, Long> snapshot = new ConcurrentHashMap<>();
        failuresByReason.forEach((reason, count) -> snapshot.put(reason, count.get()));
        return snapshot;
    }
}
