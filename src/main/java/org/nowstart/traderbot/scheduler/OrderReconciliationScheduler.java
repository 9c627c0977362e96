package org.nowstart.traderbot.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.traderbot.service.TradingSessionService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OrderReconciliationScheduler {

    private final TradingSessionService tradingSessionService;

    @Scheduled(fixedDelayString = "${traderbot.engine.reconcile-interval:PT5S}")
    public void run() {
        tradingSessionService.reconcilePendingOrders();
    }
}
