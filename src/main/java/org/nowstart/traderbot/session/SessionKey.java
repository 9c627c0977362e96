package org.nowstart.traderbot.session;

import org.nowstart.traderbot.data.type.ExecutionMode;

public record SessionKey(ExecutionMode mode, String symbol) {

    @Override
    public String toString() {
        return mode + ":" + symbol;
    }
}
