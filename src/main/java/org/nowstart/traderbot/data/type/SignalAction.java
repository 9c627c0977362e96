package org.nowstart.traderbot.data.type;

public enum SignalAction {
    BUY,
    SELL,
    HOLD
}
