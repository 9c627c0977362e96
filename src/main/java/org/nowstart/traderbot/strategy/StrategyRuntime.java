package org.nowstart.traderbot.strategy;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.data.exception.StateConflictException;
import org.nowstart.traderbot.data.exception.StrategyFaultException;
import org.nowstart.traderbot.data.type.StrategyState;
import org.nowstart.traderbot.indicator.Indicator;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;

/**
 * Hosts one strategy instance through IDLE, RUNNING and STOPPED. A stopped runtime is never restarted; a new
 * runtime is created instead.
 */
@Slf4j
@Getter
public class StrategyRuntime {

    private final String id;
    private final String strategyName;
    private final StrategyParams params;
    private final TradingStrategy strategy;
    private volatile StrategyState state = StrategyState.IDLE;
    private volatile String faultReason;

    public StrategyRuntime(String id, String strategyName, StrategyParams params, TradingStrategy strategy) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.strategyName = strategyName;
        this.params = params;
        this.strategy = Objects.requireNonNull(strategy, "strategy is required");
    }

    /**
     * Starts the strategy and returns the indicators it needs registered.
     */
    public List<Indicator> start() {
        if (state != StrategyState.IDLE) {
            throw new StateConflictException("Strategy instance " + id + " cannot start from state " + state);
        }
        try {
            strategy.onStart(params);
            List<Indicator> indicators = strategy.indicators();
            state = StrategyState.RUNNING;
            log.info("event=strategy_started id={} strategy={} params={}", id, strategyName, params);
            return indicators == null ? List.of() : indicators;
        } catch (RuntimeException exception) {
            throw fault(exception);
        }
    }

    public Signal onBar(Bar bar, Map<String, Double> indicators) {
        if (state != StrategyState.RUNNING) {
            throw new StateConflictException("Strategy instance " + id + " is not running; state=" + state);
        }
        Signal signal;
        try {
            signal = strategy.onBar(bar, indicators);
        } catch (RuntimeException exception) {
            throw fault(exception);
        }
        if (signal == null) {
            throw fault(new IllegalStateException("strategy returned no signal"));
        }
        if (!signal.isHold() && signal.symbol() != null && !signal.symbol().equals(bar.symbol())) {
            throw fault(new IllegalStateException(
                    "signal symbol " + signal.symbol() + " does not match bar symbol " + bar.symbol()
            ));
        }
        return signal;
    }

    public void stop() {
        if (state == StrategyState.STOPPED) {
            return;
        }
        boolean wasRunning = state == StrategyState.RUNNING;
        state = StrategyState.STOPPED;
        if (wasRunning) {
            try {
                strategy.onStop();
            } catch (RuntimeException exception) {
                log.warn("event=strategy_stop_failed id={} strategy={} reason={}", id, strategyName, exception.getMessage());
            }
        }
        log.info("event=strategy_stopped id={} strategy={}", id, strategyName);
    }

    public boolean isRunning() {
        return state == StrategyState.RUNNING;
    }

    private StrategyFaultException fault(RuntimeException cause) {
        state = StrategyState.STOPPED;
        faultReason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        log.error("event=strategy_fault id={} strategy={} reason={}", id, strategyName, faultReason, cause);
        return new StrategyFaultException(id, faultReason, cause);
    }
}
