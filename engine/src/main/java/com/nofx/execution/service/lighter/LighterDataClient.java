package com.nofx.execution.service.lighter;

import com.nofx.execution.model.MarketInfo;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the exchange: market listings, account records and book tops.
 * Implementations throw {@link com.nofx.execution.exception.LighterApiException} on transport
 * or protocol errors.
 */
public interface LighterDataClient {

    List<MarketInfo> listMarkets();

    Optional<LighterAccount> getAccount(long accountIndex);

    OrderBookDetail getOrderBookDetail(int marketIndex);

    record LighterAccount(
            long index,
            BigDecimal availableBalance,
            BigDecimal collateral,
            List<LighterAccountPosition> positions
    ) {
        public LighterAccount {
            positions = positions == null ? List.of() : List.copyOf(positions);
        }
    }

    /**
     * Raw position row. {@code position} is reported unsigned with the direction in {@code sign}.
     * {@code initialMarginFraction} is a percentage ("10.00" means 10x).
     */
    record LighterAccountPosition(
            int marketId,
            String symbol,
            BigDecimal initialMarginFraction,
            int sign,
            BigDecimal position,
            BigDecimal avgEntryPrice,
            BigDecimal positionValue,
            BigDecimal markPrice,
            BigDecimal unrealizedPnl,
            BigDecimal realizedPnl,
            BigDecimal liquidationPrice,
            int marginMode,
            BigDecimal allocatedMargin
    ) {
        public BigDecimal signedQuantity() {
            BigDecimal magnitude = position.abs();
            if (sign < 0 || position.signum() < 0) {
                return magnitude.negate();
            }
            return magnitude;
        }
    }

    /**
     * Any field may be null when the exchange omits it.
     */
    record OrderBookDetail(BigDecimal markPrice, BigDecimal bestAsk, BigDecimal bestBid) {}
}
