package org.nowstart.traderbot.data.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.nowstart.traderbot.data.type.PlaybackMode;

public record LoadBacktestRequest(
        @NotBlank(message = "symbol is required")
        @Schema(example = "BTC/USDT")
        String symbol,
        @NotBlank(message = "strategy is required")
        @Schema(example = "rsi")
        String strategy,
        Map<String, Object> params,
        @Schema(type = "string", example = "PT1H")
        Duration timeframe,
        @NotNull(message = "startTime is required")
        Instant startTime,
        @NotNull(message = "endTime is required")
        Instant endTime,
        PlaybackMode playbackMode,
        @Positive(message = "playbackRate must be > 0")
        Double playbackRate,
        @DecimalMin(value = "0", message = "initialBalance must be >= 0")
        BigDecimal initialBalance,
        @DecimalMin(value = "0", message = "commissionRate must be >= 0")
        @DecimalMax(value = "1", message = "commissionRate must be <= 1")
        BigDecimal commissionRate,
        @DecimalMin(value = "0", inclusive = false, message = "orderQuantity must be > 0")
        BigDecimal orderQuantity,
        Boolean allowShort
) {
}
