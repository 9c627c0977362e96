package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.nowstart.traderbot.data.type.ExecutionMode;
import org.nowstart.traderbot.data.type.SignalAction;
import org.nowstart.traderbot.data.type.StrategyState;

public record SessionStatusDto(
        String instanceId,
        ExecutionMode mode,
        String symbol,
        String strategy,
        Map<String, Object> params,
        StrategyState state,
        String faultReason,
        Instant startedAt,
        int barsProcessed,
        Instant lastBarOpenTime,
        SignalAction lastSignal,
        String lastSignalReason,
        int pendingOrders,
        BigDecimal balance,
        BigDecimal realizedPnl,
        BigDecimal equity
) {
}
