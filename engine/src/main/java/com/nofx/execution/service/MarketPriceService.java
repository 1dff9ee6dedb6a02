package com.nofx.execution.service;

import com.nofx.execution.exception.LighterApiException;
import com.nofx.execution.exception.PriceUnavailableException;
import com.nofx.execution.model.MarketInfo;
import com.nofx.execution.service.lighter.LighterDataClient;
import com.nofx.execution.service.lighter.LighterDataClient.OrderBookDetail;
import com.nofx.execution.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

@Service
@Slf4j
@RequiredArgsConstructor
public class MarketPriceService {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final MarketMetadataCache marketMetadataCache;
    private final LighterDataClient lighterDataClient;

    /**
     * Mark price when published, otherwise the mid of a two-sided book.
     *
     * @throws com.nofx.execution.exception.MarketNotFoundException if the symbol has no market
     * @throws PriceUnavailableException                             if neither source is usable
     */
    public BigDecimal getMarketPrice(String symbol) {
        return getMarketPrice(marketMetadataCache.lookup(symbol));
    }

    /**
     * Price for an already resolved market.
     */
    public BigDecimal getMarketPrice(MarketInfo market) {
        String coin = market.coin();
        OrderBookDetail detail;
        try {
            detail = lighterDataClient.getOrderBookDetail(market.marketIndex());
        } catch (LighterApiException e) {
            throw new PriceUnavailableException("Failed to fetch order book for " + coin, e);
        }
        if (DecimalUtils.isPositive(detail.markPrice())) {
            return detail.markPrice();
        }
        if (DecimalUtils.isPositive(detail.bestAsk()) && DecimalUtils.isPositive(detail.bestBid())) {
            BigDecimal mid = DecimalUtils.divide(detail.bestAsk().add(detail.bestBid()), TWO);
            log.debug("No mark price for {}, using mid {}", coin, mid);
            return mid;
        }
        throw new PriceUnavailableException("No mark price or two-sided book for " + coin);
    }
}
