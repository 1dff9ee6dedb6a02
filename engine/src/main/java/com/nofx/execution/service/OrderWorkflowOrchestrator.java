package com.nofx.execution.service;

import com.nofx.execution.config.LighterProperties;
import com.nofx.execution.exception.LeverageSetFailedException;
import com.nofx.execution.exception.LighterApiException;
import com.nofx.execution.exception.LighterCircuitOpenException;
import com.nofx.execution.exception.LighterRateLimitException;
import com.nofx.execution.exception.NoPositionToCloseException;
import com.nofx.execution.exception.OrderSubmissionFailedException;
import com.nofx.execution.exception.TradingException;
import com.nofx.execution.model.MarginMode;
import com.nofx.execution.model.MarketInfo;
import com.nofx.execution.model.OrderIntent;
import com.nofx.execution.model.OrderLifecycle;
import com.nofx.execution.model.OrderOutcome;
import com.nofx.execution.model.OrderType;
import com.nofx.execution.model.Position;
import com.nofx.execution.model.PositionSide;
import com.nofx.execution.model.TimeInForce;
import com.nofx.execution.service.lighter.TransactionSubmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Sequences the exchange calls behind each trading operation. Every workflow runs
 * under its symbol's lock and is attempted once; nothing is retried or rolled back.
 * <p>
 * Step classes:
 * <ul>
 *     <li>pre-flight (market lookup, price, position lookup): abort before any mutation</li>
 *     <li>best-effort (cancel-all around open/close): logged and reported as a warning</li>
 *     <li>critical (leverage, order submission): abort with a wrapped error</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderWorkflowOrchestrator {

    private static final int IMF_BASIS = 10_000;

    private final MarketMetadataCache marketMetadataCache;
    private final NumericCodec numericCodec;
    private final MarketPriceService marketPriceService;
    private final AccountSnapshotReader accountSnapshotReader;
    private final TransactionSubmitter transactionSubmitter;
    private final SymbolLockRegistry symbolLockRegistry;
    private final ClientOrderIndexGenerator clientOrderIndexGenerator;
    private final MetricsService metricsService;
    private final LighterProperties properties;
    private final Clock clock;

    // coin -> margin mode requested through setMarginMode
    private final Map<String, MarginMode> marginModes = new ConcurrentHashMap<>();

    public OrderOutcome openLong(String symbol, BigDecimal quantity, int leverage) {
        return open(symbol, quantity, leverage, PositionSide.LONG);
    }

    public OrderOutcome openShort(String symbol, BigDecimal quantity, int leverage) {
        return open(symbol, quantity, leverage, PositionSide.SHORT);
    }

    /**
     * @param quantity amount to close; zero closes the whole position on that side
     */
    public OrderOutcome closeLong(String symbol, BigDecimal quantity) {
        return close(symbol, quantity, PositionSide.LONG);
    }

    public OrderOutcome closeShort(String symbol, BigDecimal quantity) {
        return close(symbol, quantity, PositionSide.SHORT);
    }

    public OrderOutcome setStopLoss(String symbol, PositionSide positionSide, BigDecimal quantity, BigDecimal stopPrice) {
        return protect(symbol, positionSide, quantity, stopPrice, OrderType.STOP_LOSS);
    }

    public OrderOutcome setTakeProfit(String symbol, PositionSide positionSide, BigDecimal quantity, BigDecimal takeProfitPrice) {
        return protect(symbol, positionSide, quantity, takeProfitPrice, OrderType.TAKE_PROFIT);
    }

    /**
     * Sets leverage through an initial margin fraction of {@code 10000 / leverage}.
     *
     * @return the leverage transaction hash
     */
    public String setLeverage(String symbol, int leverage) {
        requireLeverage(leverage);
        return inWorkflow(symbol, "SET_LEVERAGE",
                () -> applyLeverage(marketMetadataCache.lookup(symbol), symbol, leverage));
    }

    /**
     * Records the margin mode for a symbol. No transaction is sent: the mode travels with the
     * next leverage update, and symbols without a request use {@code lighter.execution.margin-mode}.
     */
    public void setMarginMode(String symbol, MarginMode marginMode) {
        if (marginMode == null) {
            throw new IllegalArgumentException("marginMode is required");
        }
        marginModes.put(marketMetadataCache.toCoin(symbol), marginMode);
        log.info("Margin mode {} recorded for {}; sent with the next leverage update", marginMode, symbol);
    }

    public MarginMode marginModeFor(String symbol) {
        return marginModes.getOrDefault(marketMetadataCache.toCoin(symbol), properties.getExecution().getMarginMode());
    }

    /**
     * @return the cancel transaction hash
     */
    public String cancelAllOrders(String symbol) {
        return inWorkflow(symbol, "CANCEL_ALL", () -> {
            try {
                String handle = transactionSubmitter.cancelAllOrders(symbol, clock.millis());
                log.info("Cancelled all orders on {} hash={}", symbol, handle);
                return handle;
            } catch (LighterApiException e) {
                metricsService.recordOrderFailure("CANCEL_ALL");
                throw new TradingException("Cancel all orders failed for " + symbol, e);
            }
        });
    }

    private OrderOutcome open(String symbol, BigDecimal quantity, int leverage, PositionSide side) {
        requirePositive(quantity, "quantity");
        requireLeverage(leverage);
        String workflow = "OPEN_" + side.name();
        return inWorkflow(symbol, workflow, () -> {
            List<String> warnings = new ArrayList<>();
            cancelBestEffort(symbol, "before open", warnings);

            // resolved once; leverage, price and encoding all use this listing
            MarketInfo market = marketMetadataCache.lookup(symbol);
            applyLeverage(market, symbol, leverage);
            BigDecimal price = marketPriceService.getMarketPrice(market);

            boolean ask = side == PositionSide.SHORT;
            OrderIntent intent = OrderIntent.builder()
                    .symbol(symbol)
                    .marketIndex(market.marketIndex())
                    .clientOrderIndex(clientOrderIndexGenerator.next())
                    .rawQuantity(numericCodec.toRawSize(market, quantity))
                    .limitPrice(numericCodec.toRawPrice(market, marketablePrice(price, ask)))
                    .ask(ask)
                    .reduceOnly(false)
                    .orderType(OrderType.LIMIT)
                    .timeInForce(TimeInForce.IMMEDIATE_OR_CANCEL)
                    .build();

            String handle = send(intent, workflow);
            log.info("Opened {} {} qty={} leverage={}x hash={}", side, symbol, quantity, leverage, handle);
            return submitted(intent, handle, warnings);
        });
    }

    private OrderOutcome close(String symbol, BigDecimal quantity, PositionSide side) {
        if (quantity == null || quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity must be zero or positive");
        }
        String workflow = "CLOSE_" + side.name();
        return inWorkflow(symbol, workflow, () -> {
            BigDecimal amount = quantity;
            if (amount.signum() == 0) {
                amount = accountSnapshotReader.findPosition(symbol, side)
                        .map(Position::amount)
                        .orElseThrow(() -> new NoPositionToCloseException(symbol, side));
            }

            MarketInfo market = marketMetadataCache.lookup(symbol);
            BigDecimal price = marketPriceService.getMarketPrice(market);

            boolean ask = side.reducingOrderIsAsk();
            OrderIntent intent = OrderIntent.builder()
                    .symbol(symbol)
                    .marketIndex(market.marketIndex())
                    .clientOrderIndex(clientOrderIndexGenerator.next())
                    .rawQuantity(numericCodec.toRawSize(market, amount))
                    .limitPrice(numericCodec.toRawPrice(market, marketablePrice(price, ask)))
                    .ask(ask)
                    .reduceOnly(true)
                    .orderType(OrderType.LIMIT)
                    .timeInForce(TimeInForce.IMMEDIATE_OR_CANCEL)
                    .build();

            List<String> warnings = new ArrayList<>();
            String handle;
            try {
                handle = send(intent, workflow);
            } catch (OrderSubmissionFailedException e) {
                cancelBestEffort(symbol, "after failed close", warnings);
                throw e;
            }
            log.info("Closed {} {} qty={} hash={}", side, symbol, amount, handle);
            // leftover stop-loss / take-profit orders belong to the closed position
            cancelBestEffort(symbol, "after close", warnings);
            return submitted(intent, handle, warnings);
        });
    }

    private OrderOutcome protect(String symbol, PositionSide positionSide, BigDecimal quantity,
                                 BigDecimal triggerPrice, OrderType type) {
        if (positionSide == null) {
            throw new IllegalArgumentException("positionSide is required");
        }
        requirePositive(quantity, "quantity");
        requirePositive(triggerPrice, "triggerPrice");
        return inWorkflow(symbol, type.name(), () -> {
            MarketInfo market = marketMetadataCache.lookup(symbol);
            long rawPrice = numericCodec.toRawPrice(market, triggerPrice);
            long expiry = clock.instant()
                    .plus(Duration.ofDays(properties.getExecution().getProtectiveOrderExpiryDays()))
                    .toEpochMilli();

            OrderIntent intent = OrderIntent.builder()
                    .symbol(symbol)
                    .marketIndex(market.marketIndex())
                    .clientOrderIndex(clientOrderIndexGenerator.next())
                    .rawQuantity(numericCodec.toRawSize(market, quantity))
                    .limitPrice(rawPrice)
                    .triggerPrice(rawPrice)
                    .ask(positionSide.reducingOrderIsAsk())
                    .reduceOnly(true)
                    .orderType(type)
                    .timeInForce(TimeInForce.IMMEDIATE_OR_CANCEL)
                    .expiry(expiry)
                    .build();

            String handle = send(intent, type.name());
            log.info("{} set for {} {} at {} hash={}", type, positionSide, symbol, triggerPrice, handle);
            return submitted(intent, handle, List.of());
        });
    }

    private String applyLeverage(MarketInfo market, String symbol, int leverage) {
        int imf = IMF_BASIS / leverage;
        MarginMode marginMode = marginModeFor(symbol);
        try {
            String handle = transactionSubmitter.updateLeverage(market.marketIndex(), imf, marginMode);
            log.info("Leverage for {} set to {}x (imf={}, mode={}) hash={}", symbol, leverage, imf, marginMode, handle);
            return handle;
        } catch (LighterApiException e) {
            metricsService.recordOrderFailure("LEVERAGE");
            throw new LeverageSetFailedException("Failed to set " + leverage + "x leverage on " + symbol, e);
        }
    }

    private String send(OrderIntent intent, String workflow) {
        MDC.put("clientOrderIndex", String.valueOf(intent.getClientOrderIndex()));
        try {
            String handle = transactionSubmitter.createOrder(intent);
            metricsService.recordOrderSubmitted(workflow);
            return handle;
        } catch (LighterApiException e) {
            OrderLifecycle lifecycle = lifecycleOf(e);
            metricsService.recordOrderFailure(workflow);
            throw new OrderSubmissionFailedException(
                    workflow + " order " + intent.getClientOrderIndex() + " on " + intent.getSymbol() + " failed", lifecycle, e);
        } finally {
            MDC.remove("clientOrderIndex");
        }
    }

    /**
     * REJECTED only when the order provably did not execute: refused before sending, or answered
     * with a client error. Server errors and dropped connections may have reached the exchange.
     */
    static OrderLifecycle lifecycleOf(LighterApiException e) {
        if (e instanceof LighterCircuitOpenException || e instanceof LighterRateLimitException) {
            return OrderLifecycle.REJECTED;
        }
        int status = e.getStatusCode();
        return status > 0 && status < 500 ? OrderLifecycle.REJECTED : OrderLifecycle.UNKNOWN_OUTCOME;
    }

    private void cancelBestEffort(String symbol, String stage, List<String> warnings) {
        try {
            String handle = transactionSubmitter.cancelAllOrders(symbol, clock.millis());
            log.debug("Cancelled orders on {} {} hash={}", symbol, stage, handle);
        } catch (RuntimeException e) {
            log.warn("Failed to cancel orders on {} {}: {}", symbol, stage, e.getMessage());
            metricsService.recordBestEffortWarning();
            warnings.add("cancel-all " + stage + " failed: " + e.getMessage());
        }
    }

    private BigDecimal marketablePrice(BigDecimal price, boolean ask) {
        BigDecimal offset = properties.getExecution().getMarketableOffsetPct();
        BigDecimal factor = ask ? BigDecimal.ONE.subtract(offset) : BigDecimal.ONE.add(offset);
        return price.multiply(factor);
    }

    private OrderOutcome submitted(OrderIntent intent, String handle, List<String> warnings) {
        return new OrderOutcome(intent.getClientOrderIndex(), intent.getSymbol(), OrderLifecycle.SUBMITTED, handle, warnings);
    }

    private <T> T inWorkflow(String symbol, String workflow, Supplier<T> steps) {
        return symbolLockRegistry.withLock(symbol, () -> {
            MDC.put("symbol", symbol);
            MDC.put("workflow", workflow);
            try {
                return steps.get();
            } finally {
                MDC.remove("symbol");
                MDC.remove("workflow");
            }
        });
    }

    private static void requirePositive(BigDecimal value, String name) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireLeverage(int leverage) {
        if (leverage < 1 || leverage > IMF_BASIS) {
            throw new IllegalArgumentException("leverage must be between 1 and " + IMF_BASIS);
        }
    }
}
