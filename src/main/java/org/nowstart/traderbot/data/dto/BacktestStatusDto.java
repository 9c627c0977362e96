package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.nowstart.traderbot.data.type.BacktestState;
import org.nowstart.traderbot.data.type.PlaybackMode;

public record BacktestStatusDto(
        String id,
        String symbol,
        Duration timeframe,
        Instant startTime,
        Instant endTime,
        String strategy,
        Map<String, Object> params,
        BacktestState state,
        int cursor,
        int totalBars,
        Instant cursorTime,
        PlaybackMode playbackMode,
        double playbackRate,
        String failureReason,
        BigDecimal balance,
        BacktestSummary summary
) {
}
