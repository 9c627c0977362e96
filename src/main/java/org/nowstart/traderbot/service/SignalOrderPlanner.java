package org.nowstart.traderbot.service;

import java.math.BigDecimal;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.Position;
import org.nowstart.traderbot.data.dto.SessionSettings;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.data.type.OrderSide;
import org.nowstart.traderbot.data.type.PositionSide;
import org.nowstart.traderbot.data.type.SignalAction;
import org.springframework.stereotype.Component;

/**
 * Decides the single order a signal produces under the one-position-per-symbol rule. An opposing signal only
 * closes the open position; a signal in the direction already held is ignored.
 */
@Slf4j
@Component
public class SignalOrderPlanner {

    public static final String IGNORE_REASON_SAME_DIRECTION = "SAME_DIRECTION";
    public static final String IGNORE_REASON_SHORT_DISABLED = "SHORT_DISABLED";
    public static final String IGNORE_REASON_INVALID_QUANTITY = "INVALID_QUANTITY";

    public record OrderPlan(OrderSide side, BigDecimal quantity, boolean closesPosition) {
    }

    public Optional<OrderPlan> plan(SessionSettings settings, Position position, Signal signal) {
        if (signal.isHold()) {
            return Optional.empty();
        }

        OrderSide side = signal.action() == SignalAction.BUY ? OrderSide.BUY : OrderSide.SELL;
        PositionSide heldSide = position.isFlat() ? PositionSide.FLAT : position.side();
        if (heldSide == PositionSide.LONG && side == OrderSide.BUY
                || heldSide == PositionSide.SHORT && side == OrderSide.SELL) {
            return ignore(settings, signal, IGNORE_REASON_SAME_DIRECTION);
        }
        if (heldSide != PositionSide.FLAT) {
            return Optional.of(new OrderPlan(side, position.quantity(), true));
        }
        if (side == OrderSide.SELL && !settings.allowShort()) {
            return ignore(settings, signal, IGNORE_REASON_SHORT_DISABLED);
        }

        BigDecimal quantity = signal.quantity() != null ? signal.quantity() : settings.orderQuantity();
        if (quantity == null || quantity.signum() <= 0) {
            return ignore(settings, signal, IGNORE_REASON_INVALID_QUANTITY);
        }
        return Optional.of(new OrderPlan(side, quantity, false));
    }

    private Optional<OrderPlan> ignore(SessionSettings settings, Signal signal, String reason) {
        log.info(
                "event=signal_ignored mode={} symbol={} action={} reason={} signal_reason={}",
                settings.mode(),
                settings.symbol(),
                signal.action(),
                reason,
                signal.reason()
        );
        return Optional.empty();
    }
}
