package org.nowstart.traderbot.data.type;

public enum TradeOrderType {
    MARKET,
    LIMIT
}
