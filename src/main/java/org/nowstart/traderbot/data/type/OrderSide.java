package org.nowstart.traderbot.data.type;

public enum OrderSide {
    BUY,
    SELL
}
