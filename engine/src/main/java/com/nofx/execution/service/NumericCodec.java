package com.nofx.execution.service;

import com.nofx.execution.config.LighterProperties;
import com.nofx.execution.exception.MarketNotFoundException;
import com.nofx.execution.model.MarketInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Converts human quantities and prices to the exchange's fixed-point integers.
 * Encoding truncates toward zero: the exchange only accepts whole increments.
 * <p>
 * A symbol without cached metadata is encoded at {@code lighter.codec.fallback-decimals}
 * unless {@code lighter.codec.fail-closed-on-unknown-market} is set.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NumericCodec {

    private final MarketMetadataCache marketMetadataCache;
    private final LighterProperties properties;

    public long toRawSize(String symbol, BigDecimal quantity) {
        return encode(quantity, sizeDecimals(symbol));
    }

    public long toRawPrice(String symbol, BigDecimal price) {
        return encode(price, priceDecimals(symbol));
    }

    /**
     * Encodes at the precision of an already resolved market, without consulting the cache again.
     */
    public long toRawSize(MarketInfo market, BigDecimal quantity) {
        return encode(quantity, market.sizeDecimals());
    }

    public long toRawPrice(MarketInfo market, BigDecimal price) {
        return encode(price, market.priceDecimals());
    }

    public BigDecimal decodeRawSize(String symbol, long raw) {
        return BigDecimal.valueOf(raw, sizeDecimals(symbol));
    }

    public BigDecimal decodeRawPrice(String symbol, long raw) {
        return BigDecimal.valueOf(raw, priceDecimals(symbol));
    }

    /**
     * Quantity truncated to the market's size precision, as a plain string.
     */
    public String formatQuantity(String symbol, BigDecimal quantity) {
        return quantity.setScale(sizeDecimals(symbol), RoundingMode.DOWN).toPlainString();
    }

    public int sizeDecimals(String symbol) {
        return decimals(symbol, MarketInfo::sizeDecimals);
    }

    public int priceDecimals(String symbol) {
        return decimals(symbol, MarketInfo::priceDecimals);
    }

    private int decimals(String symbol, ToIntFunction<MarketInfo> field) {
        Optional<MarketInfo> market = marketMetadataCache.peek(symbol);
        if (market.isPresent()) {
            return field.applyAsInt(market.get());
        }
        if (properties.getCodec().isFailClosedOnUnknownMarket()) {
            throw new MarketNotFoundException(symbol);
        }
        int fallback = properties.getCodec().getFallbackDecimals();
        log.warn("No market metadata for {}, encoding with fallback precision {}", symbol, fallback);
        return fallback;
    }

    private long encode(BigDecimal value, int decimals) {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        return value.movePointRight(decimals).setScale(0, RoundingMode.DOWN).longValueExact();
    }
}
