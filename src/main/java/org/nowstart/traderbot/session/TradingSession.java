package org.nowstart.traderbot.session;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.LedgerSnapshot;
import org.nowstart.traderbot.data.dto.PendingOrder;
import org.nowstart.traderbot.data.dto.SessionSettings;
import org.nowstart.traderbot.data.dto.SessionStatusDto;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.data.exception.InsufficientBalanceException;
import org.nowstart.traderbot.data.exception.OrderSinkException;
import org.nowstart.traderbot.indicator.IndicatorEngine;
import org.nowstart.traderbot.ledger.WalletLedger;
import org.nowstart.traderbot.strategy.StrategyRuntime;

/**
 * One (mode, symbol) pipeline: strategy instance, indicator engine, bar history and wallet ledger. Sealed bars
 * are processed one at a time under the session lock, and {@link #stop()} waits for the bar in flight.
 */
@Slf4j
public class TradingSession {

    private final SessionKey key;
    private final SessionSettings settings;
    private final StrategyRuntime runtime;
    private final SignalHandler signalHandler;
    private final IndicatorEngine indicatorEngine = new IndicatorEngine();
    private final List<Bar> history = new ArrayList<>();
    private final WalletLedger ledger;
    private final Map<String, PendingOrder> pendingOrders = new LinkedHashMap<>();
    private final AtomicLong fillSequence = new AtomicLong();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Signal lastSignal;
    private volatile Instant startedAt;

    public TradingSession(SessionSettings settings, StrategyRuntime runtime, WalletLedger ledger, SignalHandler signalHandler) {
        this.key = new SessionKey(settings.mode(), settings.symbol());
        this.settings = settings;
        this.runtime = runtime;
        this.ledger = ledger;
        this.signalHandler = signalHandler;
    }

    public void start() {
        lock.lock();
        try {
            indicatorEngine.registerAll(runtime.start());
            startedAt = Instant.now();
            log.info(
                    "event=session_started session={} strategy={} instance={} timeframe={}",
                    key,
                    runtime.getStrategyName(),
                    runtime.getId(),
                    settings.timeframe()
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one sealed bar through indicators, strategy and execution.
     *
     * @return the strategy's signal, or empty when the bar was not processed
     * @throws org.nowstart.traderbot.data.exception.StrategyFaultException when the strategy fails; the session
     *                                                                     processes no further bars
     */
    public Optional<Signal> onSealedBar(Bar bar) {
        lock.lock();
        try {
            if (!runtime.isRunning()) {
                log.debug("event=bar_ignored session={} reason=NOT_RUNNING open_time={}", key, bar.openTime());
                return Optional.empty();
            }
            if (!settings.symbol().equals(bar.symbol())) {
                throw new IllegalArgumentException("Session " + key + " cannot process bar for " + bar.symbol());
            }
            Bar previous = history.isEmpty() ? null : history.get(history.size() - 1);
            if (previous != null && !bar.openTime().isAfter(previous.openTime())) {
                log.warn(
                        "event=bar_ignored session={} reason=OUT_OF_ORDER open_time={} last_open_time={}",
                        key,
                        bar.openTime(),
                        previous.openTime()
                );
                return Optional.empty();
            }

            history.add(bar);
            Map<String, Double> indicators = indicatorEngine.onBar(bar);
            Signal signal = runtime.onBar(bar, indicators);
            lastSignal = signal;
            if (signal.isHold()) {
                return Optional.of(signal);
            }

            if (!pendingOrders.isEmpty()) {
                log.info(
                        "event=signal_blocked session={} action={} reason=PENDING_ORDER pending={}",
                        key,
                        signal.action(),
                        pendingOrders.keySet()
                );
                return Optional.of(signal);
            }

            try {
                signalHandler.handle(this, signal, bar);
            } catch (InsufficientBalanceException exception) {
                log.warn(
                        "event=signal_rejected session={} action={} reason=insufficient_balance balance={} required={}",
                        key,
                        signal.action(),
                        exception.getBalance(),
                        exception.getRequired()
                );
            } catch (OrderSinkException exception) {
                log.error("event=order_submit_failed session={} action={} detail={}", key, signal.action(), exception.getMessage(), exception);
            }
            return Optional.of(signal);
        } finally {
            lock.unlock();
        }
    }

    public void stop() {
        lock.lock();
        try {
            runtime.stop();
            log.info("event=session_stopped session={} bars={} balance={}", key, history.size(), ledger.balance());
        } finally {
            lock.unlock();
        }
    }

    public <T> T exclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public String nextFillId() {
        return "sim-" + fillSequence.incrementAndGet();
    }

    public void addPendingOrder(PendingOrder order) {
        pendingOrders.put(order.orderId(), order);
    }

    public void removePendingOrder(String orderId) {
        pendingOrders.remove(orderId);
    }

    public Collection<PendingOrder> pendingOrders() {
        lock.lock();
        try {
            return List.copyOf(pendingOrders.values());
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return runtime.isRunning();
    }

    public Optional<BigDecimal> markPrice() {
        lock.lock();
        try {
            return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1).close());
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal equity() {
        return markPrice()
                .map(mark -> ledger.equity(Map.of(settings.symbol(), mark)))
                .orElseGet(() -> ledger.equity(Map.of()));
    }

    public List<Bar> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public LedgerSnapshot ledgerSnapshot() {
        return ledger.snapshot();
    }

    public SessionStatusDto status() {
        Signal signal = lastSignal;
        List<Bar> bars = history();
        return new SessionStatusDto(
                runtime.getId(),
                settings.mode(),
                settings.symbol(),
                runtime.getStrategyName(),
                runtime.getParams() == null ? Map.of() : runtime.getParams().asMap(),
                runtime.getState(),
                runtime.getFaultReason(),
                startedAt,
                bars.size(),
                bars.isEmpty() ? null : bars.get(bars.size() - 1).openTime(),
                signal == null ? null : signal.action(),
                signal == null ? null : signal.reason(),
                pendingOrders().size(),
                ledger.balance(),
                ledger.realizedPnl(),
                equity()
        );
    }

    public SessionKey key() {
        return key;
    }

    public SessionSettings settings() {
        return settings;
    }

    public StrategyRuntime runtime() {
        return runtime;
    }

    public IndicatorEngine indicatorEngine() {
        return indicatorEngine;
    }

    public WalletLedger ledger() {
        return ledger;
    }
}
