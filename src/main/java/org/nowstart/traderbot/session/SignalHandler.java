package org.nowstart.traderbot.session;

import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Signal;

/**
 * Turns a non-HOLD signal into fills or orders. Called with the session lock held.
 */
@FunctionalInterface
public interface SignalHandler {

    void handle(TradingSession session, Signal signal, Bar bar);
}
