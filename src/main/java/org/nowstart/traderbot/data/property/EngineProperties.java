package org.nowstart.traderbot.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import org.nowstart.traderbot.data.type.ExecutionMode;
import org.nowstart.traderbot.data.type.PlaybackMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "traderbot.engine")
public record EngineProperties(
        // default execution mode for new sessions (LIVE or PAPER)
        @NotNull @DefaultValue("PAPER") ExecutionMode executionMode,
        // starting balance of a fresh wallet ledger (quote currency)
        @NotNull @DecimalMin("0") @DefaultValue("1000") BigDecimal initialBalance,
        // commission rate applied to fill notional (0.001 = 0.1%)
        @NotNull @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.001") BigDecimal commissionRate,
        // order quantity used when a signal carries none
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("1") BigDecimal orderQuantity,
        // bar timeframe for live aggregation
        @NotNull @DefaultValue("1m") Duration timeframe,
        // allow SELL signals to open short positions while flat
        @DefaultValue("false") boolean allowShort,
        // bounded queue between feed thread and pipeline consumer
        @Positive @DefaultValue("1024") int ingestQueueCapacity,
        // live order reconciliation period
        @NotNull @DefaultValue("5s") Duration reconcileInterval,
        // pending live orders older than this are cancelled
        @NotNull @DefaultValue("2m") Duration orderTimeout,
        // default backtest pacing
        @NotNull @DefaultValue("AS_FAST_AS_POSSIBLE") PlaybackMode playbackMode,
        // wall-clock replay speed multiplier (2.0 = twice real time)
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.0") double playbackRate
) {
}
