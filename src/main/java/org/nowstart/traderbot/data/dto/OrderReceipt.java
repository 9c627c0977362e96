package org.nowstart.traderbot.data.dto;

import org.nowstart.traderbot.data.type.OrderStatus;

public record OrderReceipt(
        String orderId,
        OrderStatus status
) {
}
