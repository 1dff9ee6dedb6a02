package com.nofx.execution.service;

import com.nofx.execution.config.LighterProperties;
import com.nofx.execution.exception.LighterApiException;
import com.nofx.execution.exception.MarketNotFoundException;
import com.nofx.execution.model.MarketInfo;
import com.nofx.execution.service.lighter.LighterDataClient;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-coin market metadata. The map is immutable and swapped whole on reload, so
 * readers see either the previous listing or the new one, never a mix.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketMetadataCache {

    private final LighterDataClient lighterDataClient;
    private final LighterProperties properties;
    private final MetricsService metricsService;

    private final AtomicReference<Map<String, MarketInfo>> markets = new AtomicReference<>(Map.of());

    @PostConstruct
    public void init() {
        try {
            reload();
        } catch (LighterApiException e) {
            log.warn("Initial market metadata load failed, will reload on first lookup: {}", e.getMessage());
        }
    }

    /**
     * Fetches the full market listing and replaces the cache. On failure the
     * previous listing stays in place.
     */
    public void reload() {
        List<MarketInfo> listing;
        try {
            listing = lighterDataClient.listMarkets();
        } catch (LighterApiException e) {
            metricsService.recordMetadataReload(false, 0);
            throw e;
        }
        Map<String, MarketInfo> next = new HashMap<>();
        for (MarketInfo market : listing) {
            next.put(market.coin().toUpperCase(Locale.ROOT), market);
        }
        markets.set(Map.copyOf(next));
        metricsService.recordMetadataReload(true, next.size());
        log.info("Loaded {} Lighter markets", next.size());
    }

    /**
     * Resolves a symbol, reloading once on a miss.
     *
     * @throws MarketNotFoundException if the market is still absent after the reload,
     *                                 or the reload itself failed
     */
    public MarketInfo lookup(String symbol) {
        String coin = toCoin(symbol);
        MarketInfo cached = markets.get().get(coin);
        if (cached != null) {
            return cached;
        }
        log.info("Market {} not cached, reloading metadata", coin);
        try {
            reload();
        } catch (LighterApiException e) {
            throw new MarketNotFoundException(symbol, e);
        }
        MarketInfo reloaded = markets.get().get(coin);
        if (reloaded == null) {
            throw new MarketNotFoundException(symbol);
        }
        return reloaded;
    }

    /**
     * Cache probe without reload.
     */
    public Optional<MarketInfo> peek(String symbol) {
        return Optional.ofNullable(markets.get().get(toCoin(symbol)));
    }

    public Map<String, MarketInfo> snapshot() {
        return markets.get();
    }

    /**
     * "ETHUSDT" -> "ETH". Symbols without the quote suffix are taken as coins.
     */
    public String toCoin(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        String upper = symbol.trim().toUpperCase(Locale.ROOT);
        String suffix = properties.getQuoteSuffix().toUpperCase(Locale.ROOT);
        if (upper.length() > suffix.length() && upper.endsWith(suffix)) {
            return upper.substring(0, upper.length() - suffix.length());
        }
        return upper;
    }

    public String toSymbol(String coin) {
        return coin.toUpperCase(Locale.ROOT) + properties.getQuoteSuffix().toUpperCase(Locale.ROOT);
    }
}
