package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.traderbot.data.type.OrderSide;

public record PendingOrder(
        String orderId,
        String symbol,
        OrderSide side,
        BigDecimal quantity,
        Instant submittedAt,
        String signalReason,
        boolean cancelRequested
) {

    public PendingOrder withCancelRequested() {
        return new PendingOrder(orderId, symbol, side, quantity, submittedAt, signalReason, true);
    }
}
