package org.nowstart.traderbot.backtest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.BacktestStatusDto;
import org.nowstart.traderbot.data.dto.BacktestSummary;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.ClosedTrade;
import org.nowstart.traderbot.data.dto.LedgerSnapshot;
import org.nowstart.traderbot.data.exception.StateConflictException;
import org.nowstart.traderbot.data.exception.StrategyFaultException;
import org.nowstart.traderbot.data.exception.TradingApiException;
import org.nowstart.traderbot.data.type.BacktestState;
import org.nowstart.traderbot.session.TradingSession;
import org.springframework.http.HttpStatus;

/**
 * Replays a fixed, ascending bar sequence through a {@link TradingSession}.
 *
 * <p>State machine: LOADED → RUNNING ⇄ PAUSED → FINISHED. The cursor is the index of the next bar and only
 * moves forward. Navigation is allowed while PAUSED or FINISHED and still runs every passed bar through the
 * pipeline; once stopped or faulted the strategy is gone, so only a no-op move is accepted. The replay loop runs on one thread at a time; {@link #pause()} and {@link #stop()} may be called from
 * any thread and take effect before the next bar.
 */
@Slf4j
public class BacktestSession {

    private static final int SCALE = 12;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String id;
    private final List<Bar> bars;
    private final TradingSession session;
    private final PlaybackPacer pacer;
    private final Instant startTime;
    private final Instant endTime;
    private final List<BigDecimal> equityCurve = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition stateChanged = lock.newCondition();
    private volatile BacktestState state = BacktestState.LOADED;
    private volatile int cursor;
    private volatile String failureReason;
    private boolean loopActive;

    public BacktestSession(
            String id,
            List<Bar> bars,
            TradingSession session,
            PlaybackPacer pacer,
            Instant startTime,
            Instant endTime
    ) {
        if (bars.isEmpty()) {
            throw new IllegalArgumentException("bars must not be empty");
        }
        this.id = id;
        this.bars = List.copyOf(bars);
        this.session = session;
        this.pacer = pacer;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    /**
     * Moves LOADED or PAUSED to RUNNING.
     *
     * @return {@code true} when the caller must now run {@link #runLoop()}; {@code false} when a loop is still
     *         active from before a pause and simply resumes
     */
    public boolean start() {
        lock.lock();
        try {
            if (state != BacktestState.LOADED && state != BacktestState.PAUSED) {
                throw new StateConflictException("Backtest " + id + " cannot start from state " + state);
            }
            state = BacktestState.RUNNING;
            stateChanged.signalAll();
            log.info("event=backtest_running id={} cursor={} total={}", id, cursor, bars.size());
            if (loopActive) {
                return false;
            }
            loopActive = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replays bars while RUNNING. Returns when the backtest is paused, stopped or finished.
     */
    public void runLoop() {
        boolean released = false;
        try {
            while (true) {
                lock.lock();
                try {
                    if (state != BacktestState.RUNNING) {
                        // cleared under the lock that observed the exit
                        loopActive = false;
                        released = true;
                        return;
                    }
                    step();
                    if (state == BacktestState.RUNNING && !pacer.delay().isZero() && cursor < bars.size()) {
                        stateChanged.await(pacer.delay().toNanos(), TimeUnit.NANOSECONDS);
                    }
                } finally {
                    lock.unlock();
                }
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            log.warn("event=backtest_interrupted id={} cursor={}", id, cursor);
        } finally {
            if (!released) {
                lock.lock();
                try {
                    if (state == BacktestState.RUNNING) {
                        state = BacktestState.PAUSED;
                    }
                    loopActive = false;
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    /**
     * Starts and replays on the calling thread until the sequence is exhausted, stopped or faulted.
     */
    public BacktestSummary runToCompletion() {
        if (start()) {
            runLoop();
        }
        return summary();
    }

    public void pause() {
        lock.lock();
        try {
            if (state != BacktestState.RUNNING) {
                throw new StateConflictException("Backtest " + id + " cannot pause from state " + state);
            }
            state = BacktestState.PAUSED;
            stateChanged.signalAll();
            log.info("event=backtest_paused id={} cursor={}", id, cursor);
        } finally {
            lock.unlock();
        }
    }

    public void stop() {
        lock.lock();
        try {
            if (state == BacktestState.FINISHED) {
                return;
            }
            finish("stopped");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advances the cursor to {@code index}, processing every bar in between.
     */
    public void seek(int index) {
        lock.lock();
        try {
            if (state != BacktestState.PAUSED && state != BacktestState.FINISHED) {
                throw new StateConflictException("Backtest " + id + " can only navigate while PAUSED or FINISHED; state=" + state);
            }
            if (index < cursor) {
                throw new TradingApiException(
                        HttpStatus.BAD_REQUEST,
                        "invalid_seek",
                        "Backtest " + id + " cannot move backwards from " + cursor + " to " + index
                );
            }
            if (index > bars.size()) {
                throw new TradingApiException(
                        HttpStatus.BAD_REQUEST,
                        "invalid_seek",
                        "Backtest " + id + " has " + bars.size() + " bars; cannot seek to " + index
                );
            }
            if (index > cursor && !session.isRunning()) {
                throw new StateConflictException(
                        "Backtest " + id + " was " + (failureReason != null ? "faulted" : "stopped") + "; bars can no longer be replayed"
                );
            }
            int from = cursor;
            while (cursor < index) {
                step();
            }
            log.info("event=backtest_seek id={} from={} to={}", id, from, cursor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advances to the first bar opening at or after {@code time}, or to the end when there is none.
     */
    public void seekTo(Instant time) {
        lock.lock();
        try {
            int index = cursor;
            while (index < bars.size() && bars.get(index).openTime().isBefore(time)) {
                index++;
            }
            seek(index);
        } finally {
            lock.unlock();
        }
    }

    public void skip(int count) {
        if (count < 0) {
            throw new TradingApiException(HttpStatus.BAD_REQUEST, "invalid_seek", "skip count must be >= 0");
        }
        lock.lock();
        try {
            seek((int) Math.min((long) cursor + count, bars.size()));
        } finally {
            lock.unlock();
        }
    }

    public BacktestSummary summary() {
        lock.lock();
        try {
            LedgerSnapshot ledger = session.ledgerSnapshot();
            BigDecimal initial = ledger.initialBalance();
            BigDecimal finalEquity = equityCurve.isEmpty() ? initial : equityCurve.get(equityCurve.size() - 1);
            List<ClosedTrade> trades = ledger.closedTrades();
            long wins = trades.stream().filter(ClosedTrade::isWin).count();
            return new BacktestSummary(
                    cursor,
                    bars.size(),
                    initial,
                    ledger.balance(),
                    finalEquity,
                    ledger.realizedPnl(),
                    percent(finalEquity.subtract(initial), initial),
                    trades.size(),
                    percent(BigDecimal.valueOf(wins), BigDecimal.valueOf(trades.size())),
                    maxDrawdownPct(initial)
            );
        } finally {
            lock.unlock();
        }
    }

    public BacktestStatusDto status() {
        lock.lock();
        try {
            return new BacktestStatusDto(
                    id,
                    session.settings().symbol(),
                    session.settings().timeframe(),
                    startTime,
                    endTime,
                    session.runtime().getStrategyName(),
                    session.runtime().getParams() == null ? Map.of() : session.runtime().getParams().asMap(),
                    state,
                    cursor,
                    bars.size(),
                    cursor < bars.size() ? bars.get(cursor).openTime() : null,
                    pacer.mode(),
                    pacer.rate(),
                    failureReason,
                    session.ledger().balance(),
                    summary()
            );
        } finally {
            lock.unlock();
        }
    }

    public String id() {
        return id;
    }

    public BacktestState state() {
        return state;
    }

    public int cursor() {
        return cursor;
    }

    public String failureReason() {
        return failureReason;
    }

    public TradingSession session() {
        return session;
    }

    public List<BigDecimal> equityCurve() {
        lock.lock();
        try {
            return List.copyOf(equityCurve);
        } finally {
            lock.unlock();
        }
    }

    private void step() {
        Bar bar = bars.get(cursor);
        try {
            session.onSealedBar(bar);
        } catch (StrategyFaultException exception) {
            failureReason = exception.getMessage();
            log.error("event=backtest_faulted id={} cursor={} reason={}", id, cursor, failureReason);
        }
        cursor++;
        equityCurve.add(session.equity());
        if (failureReason != null) {
            finish("fault");
        } else if (cursor >= bars.size()) {
            finish("exhausted");
        }
    }

    private void finish(String reason) {
        state = BacktestState.FINISHED;
        session.stop();
        stateChanged.signalAll();
        log.info(
                "event=backtest_finished id={} reason={} cursor={} total={} balance={}",
                id,
                reason,
                cursor,
                bars.size(),
                session.ledger().balance()
        );
    }

    private BigDecimal maxDrawdownPct(BigDecimal initial) {
        BigDecimal peak = initial;
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        for (BigDecimal equity : equityCurve) {
            if (equity.compareTo(peak) > 0) {
                peak = equity;
            }
            if (peak.signum() > 0) {
                BigDecimal drawdown = peak.subtract(equity).multiply(HUNDRED).divide(peak, SCALE, RoundingMode.HALF_UP);
                maxDrawdown = maxDrawdown.max(drawdown);
            }
        }
        return maxDrawdown;
    }

    private BigDecimal percent(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, SCALE, RoundingMode.HALF_UP);
    }
}
