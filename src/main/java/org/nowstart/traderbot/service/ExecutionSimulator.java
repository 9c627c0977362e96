package org.nowstart.traderbot.service;

import java.math.BigDecimal;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Fill;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.service.SignalOrderPlanner.OrderPlan;
import org.nowstart.traderbot.session.TradingSession;
import org.springframework.stereotype.Service;

/**
 * Simulated execution at the bar close with a flat commission on notional and no slippage. Fill ids and
 * timestamps come from the session sequence and the bar, so replays produce identical ledgers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionSimulator {

    private final SignalOrderPlanner signalOrderPlanner;

    /**
     * @throws org.nowstart.traderbot.data.exception.InsufficientBalanceException when the fill would overdraw the
     *                                                                           ledger, which is then left unchanged
     */
    public Optional<Fill> execute(TradingSession session, Signal signal, Bar bar) {
        Optional<OrderPlan> plan = signalOrderPlanner.plan(
                session.settings(),
                session.ledger().position(bar.symbol()),
                signal
        );
        if (plan.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal price = bar.close();
        BigDecimal quantity = plan.get().quantity();
        BigDecimal commission = price.multiply(quantity).multiply(session.settings().commissionRate());
        String fillId = session.nextFillId();
        Fill fill = new Fill(
                fillId,
                bar.symbol(),
                plan.get().side(),
                price,
                quantity,
                commission,
                bar.closeTime(),
                fillId
        );
        session.ledger().applyFill(fill);
        log.info(
                "event=trade_execution mode={} symbol={} side={} price={} qty={} commission={} balance={} reason={}",
                session.settings().mode(),
                fill.symbol(),
                fill.side(),
                fill.price(),
                fill.quantity(),
                fill.commission(),
                session.ledger().balance(),
                signal.reason()
        );
        return Optional.of(fill);
    }
}
