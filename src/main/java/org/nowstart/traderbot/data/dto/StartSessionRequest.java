package org.nowstart.traderbot.data.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import org.nowstart.traderbot.data.type.ExecutionMode;

public record StartSessionRequest(
        @Schema(description = "LIVE or PAPER; defaults to traderbot.engine.execution-mode")
        ExecutionMode mode,
        @NotBlank(message = "symbol is required")
        @Schema(example = "BTC/USDT")
        String symbol,
        @NotBlank(message = "strategy is required")
        @Schema(example = "ma_crossover")
        String strategy,
        @Schema(example = "{\"fast_period\": 20, \"slow_period\": 50}")
        Map<String, Object> params,
        @Schema(type = "string", example = "PT1M")
        Duration timeframe,
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
