package org.nowstart.traderbot.gateway;

import java.math.BigDecimal;
import java.util.List;
import org.nowstart.traderbot.data.dto.AccountInfo;
import org.nowstart.traderbot.data.dto.OrderReceipt;
import org.nowstart.traderbot.data.dto.OrderStatusReport;
import org.nowstart.traderbot.data.dto.TradeRecord;
import org.nowstart.traderbot.data.type.OrderSide;
import org.nowstart.traderbot.data.type.TradeOrderType;

/**
 * Live order placement on an exchange. Any method may throw a runtime exception when the exchange call fails.
 */
public interface OrderSink {

    OrderReceipt placeOrder(String symbol, OrderSide side, TradeOrderType type, BigDecimal quantity);

    OrderStatusReport getOrderStatus(String orderId);

    void cancelOrder(String orderId);

    AccountInfo getAccountInfo();

    List<TradeRecord> getTradeHistory(String symbol);
}
