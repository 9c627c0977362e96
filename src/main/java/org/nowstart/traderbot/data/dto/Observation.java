package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record Observation(
        String symbol,
        BigDecimal price,
        BigDecimal quantity,
        Instant timestamp
) {
}
