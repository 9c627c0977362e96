package org.nowstart.traderbot.market;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Observation;
import org.nowstart.traderbot.data.exception.StaleObservationException;
import org.nowstart.traderbot.data.exception.StrategyFaultException;
import org.nowstart.traderbot.gateway.MarketDataListener;
import org.nowstart.traderbot.gateway.MarketDataSource;
import org.nowstart.traderbot.gateway.MarketDataSubscription;
import org.nowstart.traderbot.session.TradingSession;

/**
 * Live ingestion for one session. The feed thread only normalizes and enqueues; a single consumer thread
 * aggregates and drives the session in arrival order. A full queue blocks the feed thread.
 */
@Slf4j
public class SymbolPipeline implements MarketDataListener {

    private static final long POLL_MILLIS = 250L;
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final TradingSession session;
    private final ObservationNormalizer normalizer;
    private final OhlcAggregator aggregator;
    private final BlockingQueue<Observation> queue;
    private final Clock clock;
    private final Consumer<TradingSession> onFault;
    private final Thread consumer;
    private volatile boolean running;
    private volatile MarketDataSubscription subscription;

    public SymbolPipeline(
            TradingSession session,
            ObservationNormalizer normalizer,
            int queueCapacity,
            Clock clock,
            Consumer<TradingSession> onFault
    ) {
        this.session = session;
        this.normalizer = normalizer;
        this.aggregator = new OhlcAggregator(session.settings().symbol(), session.settings().timeframe());
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.clock = clock;
        this.onFault = onFault;
        this.consumer = new Thread(this::consume, "pipeline-" + session.key());
        this.consumer.setDaemon(true);
    }

    public void start(MarketDataSource source) {
        running = true;
        consumer.start();
        subscription = source.subscribe(session.settings().symbol(), this);
        log.info("event=pipeline_started session={} queue_capacity={}", session.key(), queue.remainingCapacity());
    }

    @Override
    public void onObservation(Observation raw) {
        if (!running) {
            return;
        }
        normalizer.normalize(raw).ifPresent(observation -> {
            try {
                queue.put(observation);
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                log.warn("event=observation_dropped session={} reason=interrupted", session.key());
            }
        });
    }

    @Override
    public void onDisconnected(Throwable cause) {
        log.warn(
                "event=feed_disconnected session={} reason={}",
                session.key(),
                cause == null ? "unknown" : cause.getMessage()
        );
    }

    @Override
    public void onReconnected() {
        log.info("event=feed_reconnected session={}", session.key());
    }

    /**
     * Stops ingestion, lets the consumer drain what is already queued, then stops the session.
     */
    public void stop() {
        requestStop();
        if (Thread.currentThread() != consumer) {
            try {
                consumer.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
            }
            if (consumer.isAlive()) {
                log.warn("event=pipeline_stop_timeout session={} pending={}", session.key(), queue.size());
                consumer.interrupt();
            }
        }
        session.stop();
        log.info("event=pipeline_stopped session={}", session.key());
    }

    /**
     * Non-blocking stop request; safe to call from the consumer thread.
     */
    public void requestStop() {
        running = false;
        MarketDataSubscription current = subscription;
        subscription = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException exception) {
                log.warn("event=unsubscribe_failed session={} reason={}", session.key(), exception.getMessage());
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    public TradingSession session() {
        return session;
    }

    public OhlcAggregator aggregator() {
        return aggregator;
    }

    private void consume() {
        while (running || !queue.isEmpty()) {
            Observation observation;
            try {
                observation = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
                log.warn("event=pipeline_interrupted session={} dropped={}", session.key(), queue.size());
                return;
            }
            if (observation != null) {
                ingest(observation);
            } else if (running) {
                aggregator.sealIfElapsed(clock.instant()).ifPresent(this::dispatch);
            }
        }
    }

    private void ingest(Observation observation) {
        try {
            aggregator.ingest(observation).ifPresent(this::dispatch);
        } catch (StaleObservationException exception) {
            log.warn(
                    "event=observation_dropped session={} reason=stale observed_at={} open_window={}",
                    session.key(),
                    exception.getObservedAt(),
                    exception.getOpenWindowStart()
            );
        } catch (IllegalArgumentException exception) {
            log.warn("event=observation_dropped session={} reason={}", session.key(), exception.getMessage());
        }
    }

    private void dispatch(Bar bar) {
        try {
            session.onSealedBar(bar);
        } catch (StrategyFaultException exception) {
            log.error("event=session_faulted session={} reason={}", session.key(), exception.getMessage());
            requestStop();
            queue.clear();
            onFault.accept(session);
        } catch (RuntimeException exception) {
            log.error("event=bar_processing_failed session={} open_time={}", session.key(), bar.openTime(), exception);
        }
    }
}
