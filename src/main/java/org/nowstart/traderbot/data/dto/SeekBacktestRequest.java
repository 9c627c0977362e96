package org.nowstart.traderbot.data.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;

public record SeekBacktestRequest(
        @PositiveOrZero(message = "index must be >= 0")
        @Schema(description = "target cursor index; takes precedence over time")
        Integer index,
        @Schema(description = "advance to the first bar opening at or after this time")
        Instant time
) {
}
