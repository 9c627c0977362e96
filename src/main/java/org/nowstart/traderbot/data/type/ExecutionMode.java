package org.nowstart.traderbot.data.type;

public enum ExecutionMode {
    LIVE,
    PAPER
}
