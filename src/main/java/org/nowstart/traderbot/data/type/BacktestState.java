package org.nowstart.traderbot.data.type;

public enum BacktestState {
    LOADED,
    RUNNING,
    PAUSED,
    FINISHED
}
