package org.nowstart.traderbot.data.type;

public enum StrategyState {
    IDLE,
    RUNNING,
    STOPPED
}
