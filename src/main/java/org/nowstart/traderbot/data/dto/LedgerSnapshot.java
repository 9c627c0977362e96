package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.util.List;

public record LedgerSnapshot(
        BigDecimal balance,
        BigDecimal initialBalance,
        BigDecimal realizedPnl,
        List<Position> openPositions,
        List<ClosedTrade> closedTrades,
        List<Fill> fills
) {
}
