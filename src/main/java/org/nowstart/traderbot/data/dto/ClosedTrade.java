package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.traderbot.data.type.PositionSide;

public record ClosedTrade(
        String symbol,
        PositionSide side,
        BigDecimal entryPrice,
        BigDecimal exitPrice,
        BigDecimal quantity,
        Instant openedAt,
        Instant closedAt,
        BigDecimal commission,
        BigDecimal profit,
        BigDecimal profitPct
) {

    public boolean isWin() {
        return profit.signum() > 0;
    }
}
