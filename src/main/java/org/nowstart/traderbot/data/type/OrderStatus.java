package org.nowstart.traderbot.data.type;

public enum OrderStatus {
    CREATED,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    REJECTED,
    CANCELED,
    FAILED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELED || this == FAILED;
    }
}
