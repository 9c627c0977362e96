package org.nowstart.traderbot.data.type;

public enum PositionSide {
    LONG,
    SHORT,
    FLAT
}
