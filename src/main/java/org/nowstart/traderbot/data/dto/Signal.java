package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import org.nowstart.traderbot.data.type.SignalAction;

public record Signal(
        SignalAction action,
        String symbol,
        BigDecimal quantity,
        String reason
) {

    public static Signal buy(String symbol, String reason) {
        return new Signal(SignalAction.BUY, symbol, null, reason);
    }

    public static Signal sell(String symbol, String reason) {
        return new Signal(SignalAction.SELL, symbol, null, reason);
    }

    public static Signal hold(String symbol) {
        return new Signal(SignalAction.HOLD, symbol, null, "NONE");
    }

    public boolean isHold() {
        return action == null || action == SignalAction.HOLD;
    }
}
