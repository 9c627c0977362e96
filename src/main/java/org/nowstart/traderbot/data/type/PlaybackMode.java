package org.nowstart.traderbot.data.type;

public enum PlaybackMode {
    AS_FAST_AS_POSSIBLE,
    WALL_CLOCK
}
