package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.traderbot.data.type.PositionSide;

public record Position(
        String symbol,
        PositionSide side,
        BigDecimal entryPrice,
        BigDecimal quantity,
        Instant openedAt,
        BigDecimal entryCommission
) {

    public static Position flat(String symbol) {
        return new Position(symbol, PositionSide.FLAT, BigDecimal.ZERO, BigDecimal.ZERO, null, BigDecimal.ZERO);
    }

    public boolean isFlat() {
        return side == PositionSide.FLAT || quantity.signum() == 0;
    }
}
