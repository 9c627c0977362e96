package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;

public record BacktestSummary(
        int barsProcessed,
        int totalBars,
        BigDecimal initialBalance,
        BigDecimal finalBalance,
        BigDecimal finalEquity,
        BigDecimal realizedPnl,
        BigDecimal returnPct,
        int tradeCount,
        BigDecimal winRatePct,
        BigDecimal maxDrawdownPct
) {
}
