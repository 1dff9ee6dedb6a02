package com.nofx.execution.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per coin. A workflow holds it from its first exchange call to its last,
 * so two workflows on the same market never interleave.
 */
@Component
@RequiredArgsConstructor
public class SymbolLockRegistry {

    private final MarketMetadataCache marketMetadataCache;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String symbol, Supplier<T> action) {
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String symbol) {
        return lockFor(symbol).isLocked();
    }

    private ReentrantLock lockFor(String symbol) {
        return locks.computeIfAbsent(marketMetadataCache.toCoin(symbol), ignored -> new ReentrantLock(true));
    }
}
