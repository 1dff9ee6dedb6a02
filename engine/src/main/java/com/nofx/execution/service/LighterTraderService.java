package com.nofx.execution.service;

import com.nofx.execution.model.AccountSnapshot;
import com.nofx.execution.model.MarginMode;
import com.nofx.execution.model.OrderOutcome;
import com.nofx.execution.model.Position;
import com.nofx.execution.model.PositionSide;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Trading operations on one Lighter account, as seen by a strategy.
 */
@Service
@RequiredArgsConstructor
public class LighterTraderService {

    private final AccountSnapshotReader accountSnapshotReader;
    private final MarketPriceService marketPriceService;
    private final OrderWorkflowOrchestrator orderWorkflowOrchestrator;
    private final NumericCodec numericCodec;

    public AccountSnapshot getBalance() {
        return accountSnapshotReader.getBalance();
    }

    public List<Position> getPositions() {
        return accountSnapshotReader.getPositions();
    }

    public Optional<Position> findPosition(String symbol, PositionSide side) {
        return accountSnapshotReader.findPosition(symbol, side);
    }

    public BigDecimal getMarketPrice(String symbol) {
        return marketPriceService.getMarketPrice(symbol);
    }

    public OrderOutcome openLong(String symbol, BigDecimal quantity, int leverage) {
        return orderWorkflowOrchestrator.openLong(symbol, quantity, leverage);
    }

    public OrderOutcome openShort(String symbol, BigDecimal quantity, int leverage) {
        return orderWorkflowOrchestrator.openShort(symbol, quantity, leverage);
    }

    public OrderOutcome closeLong(String symbol, BigDecimal quantity) {
        return orderWorkflowOrchestrator.closeLong(symbol, quantity);
    }

    public OrderOutcome closeShort(String symbol, BigDecimal quantity) {
        return orderWorkflowOrchestrator.closeShort(symbol, quantity);
    }

    public String setLeverage(String symbol, int leverage) {
        return orderWorkflowOrchestrator.setLeverage(symbol, leverage);
    }

    public void setMarginMode(String symbol, MarginMode marginMode) {
        orderWorkflowOrchestrator.setMarginMode(symbol, marginMode);
    }

    public OrderOutcome setStopLoss(String symbol, PositionSide positionSide, BigDecimal quantity, BigDecimal stopPrice) {
        return orderWorkflowOrchestrator.setStopLoss(symbol, positionSide, quantity, stopPrice);
    }

    public OrderOutcome setTakeProfit(String symbol, PositionSide positionSide, BigDecimal quantity, BigDecimal takeProfitPrice) {
        return orderWorkflowOrchestrator.setTakeProfit(symbol, positionSide, quantity, takeProfitPrice);
    }

    public String cancelAllOrders(String symbol) {
        return orderWorkflowOrchestrator.cancelAllOrders(symbol);
    }

    public String formatQuantity(String symbol, BigDecimal quantity) {
        return numericCodec.formatQuantity(symbol, quantity);
    }
}
