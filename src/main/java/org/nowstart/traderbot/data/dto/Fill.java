package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.traderbot.data.type.OrderSide;

public record Fill(
        String fillId,
        String symbol,
        OrderSide side,
        BigDecimal price,
        BigDecimal quantity,
        BigDecimal commission,
        Instant executedAt,
        String orderId
) {

    public BigDecimal notional() {
        return price.multiply(quantity);
    }
}
