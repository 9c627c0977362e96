package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Duration;
import org.nowstart.traderbot.data.type.ExecutionMode;

public record SessionSettings(
        ExecutionMode mode,
        String symbol,
        Duration timeframe,
        BigDecimal initialBalance,
        BigDecimal commissionRate,
        BigDecimal orderQuantity,
        boolean allowShort
) {
}
