package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.traderbot.data.type.OrderStatus;

public record OrderStatusReport(
        String orderId,
        OrderStatus status,
        BigDecimal executedQuantity,
        BigDecimal averagePrice,
        BigDecimal commission,
        Instant updatedAt
) {
}
