package org.nowstart.traderbot.service;

import lombok.RequiredArgsConstructor;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.data.type.ExecutionMode;
import org.nowstart.traderbot.session.SignalHandler;
import org.nowstart.traderbot.session.TradingSession;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExecutionService implements SignalHandler {

    private final ExecutionSimulator executionSimulator;
    private final OrderRouter orderRouter;

    @Override
    public void handle(TradingSession session, Signal signal, Bar bar) {
        if (session.settings().mode() == ExecutionMode.LIVE) {
            orderRouter.submit(session, signal, bar);
            return;
        }
        executionSimulator.execute(session, signal, bar);
    }
}
