package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;

public record AssetBalance(
        String asset,
        BigDecimal free,
        BigDecimal locked
) {
}
