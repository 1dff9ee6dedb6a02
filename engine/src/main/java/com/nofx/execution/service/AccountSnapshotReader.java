package com.nofx.execution.service;

import com.nofx.execution.config.LighterProperties;
import com.nofx.execution.exception.AccountNotFoundException;
import com.nofx.execution.model.AccountSnapshot;
import com.nofx.execution.model.Position;
import com.nofx.execution.model.PositionSide;
import com.nofx.execution.service.lighter.LighterDataClient;
import com.nofx.execution.service.lighter.LighterDataClient.LighterAccount;
import com.nofx.execution.service.lighter.LighterDataClient.LighterAccountPosition;
import com.nofx.execution.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Projects the live account record into balances and positions. Nothing is cached:
 * each call is its own fetch, and two calls may observe different account states.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AccountSnapshotReader {

    private final LighterDataClient lighterDataClient;
    private final MarketMetadataCache marketMetadataCache;
    private final LighterProperties properties;

    public AccountSnapshot getBalance() {
        LighterAccount account = lighterDataClient.getAccount(properties.getAccountIndex())
                .orElseThrow(() -> new AccountNotFoundException(properties.getAccountIndex()));

        BigDecimal unrealizedPnl = BigDecimal.ZERO;
        for (LighterAccountPosition position : account.positions()) {
            unrealizedPnl = unrealizedPnl.add(position.unrealizedPnl());
        }
        // collateral already includes unrealized P&L
        BigDecimal walletBalance = account.collateral().subtract(unrealizedPnl);

        AccountSnapshot snapshot = new AccountSnapshot(walletBalance, account.availableBalance(), unrealizedPnl);
        log.info("Lighter account {}: equity={} (wallet={} + unrealized={}), available={}",
                account.index(), account.collateral(), walletBalance, unrealizedPnl, account.availableBalance());
        return snapshot;
    }

    public List<Position> getPositions() {
        Optional<LighterAccount> account = lighterDataClient.getAccount(properties.getAccountIndex());
        if (account.isEmpty()) {
            return List.of();
        }
        List<Position> positions = new ArrayList<>();
        for (LighterAccountPosition raw : account.get().positions()) {
            BigDecimal signed = raw.signedQuantity();
            // zero rows are dropped before any per-unit division below
            if (signed.signum() == 0) {
                continue;
            }
            positions.add(toPosition(raw, signed));
        }
        return positions;
    }

    /**
     * Fresh account query for one open position. Used to confirm that a submitted
     * order actually changed exposure.
     */
    public Optional<Position> findPosition(String symbol, PositionSide side) {
        String coin = marketMetadataCache.toCoin(symbol);
        return getPositions().stream()
                .filter(position -> position.side() == side)
                .filter(position -> marketMetadataCache.toCoin(position.symbol()).equals(coin))
                .findFirst();
    }

    private Position toPosition(LighterAccountPosition raw, BigDecimal signed) {
        PositionSide side = signed.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT;
        BigDecimal amount = signed.abs();

        BigDecimal markPrice = DecimalUtils.isPositive(raw.markPrice())
                ? raw.markPrice()
                : DecimalUtils.divide(raw.positionValue(), amount);

        BigDecimal imf = raw.initialMarginFraction();
        BigDecimal leverage = DecimalUtils.isPositive(imf)
                ? DecimalUtils.divide(DecimalUtils.HUNDRED, imf)
                : null;

        return new Position(
                marketMetadataCache.toSymbol(raw.symbol()),
                side,
                amount,
                raw.avgEntryPrice(),
                markPrice,
                raw.unrealizedPnl(),
                raw.liquidationPrice(),
                leverage
        );
    }
}
