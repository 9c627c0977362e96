package org.nowstart.traderbot.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.backtest.BacktestSession;
import org.nowstart.traderbot.backtest.PlaybackPacer;
import org.nowstart.traderbot.data.dto.BacktestStatusDto;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.LoadBacktestRequest;
import org.nowstart.traderbot.data.dto.SeekBacktestRequest;
import org.nowstart.traderbot.data.dto.SessionSettings;
import org.nowstart.traderbot.data.exception.HistoryFetchException;
import org.nowstart.traderbot.data.exception.TradingApiException;
import org.nowstart.traderbot.data.property.EngineProperties;
import org.nowstart.traderbot.data.type.ExecutionMode;
import org.nowstart.traderbot.data.type.PlaybackMode;
import org.nowstart.traderbot.gateway.MarketDataSource;
import org.nowstart.traderbot.ledger.WalletLedger;
import org.nowstart.traderbot.market.ObservationNormalizer;
import org.nowstart.traderbot.session.TradingSession;
import org.nowstart.traderbot.strategy.StrategyParamValidator;
import org.nowstart.traderbot.strategy.StrategyRegistry;
import org.nowstart.traderbot.strategy.StrategyRuntime;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class BacktestService {

    private final StrategyRegistry strategyRegistry;
    private final StrategyParamValidator strategyParamValidator;
    private final ExecutionSimulator executionSimulator;
    private final ObservationNormalizer observationNormalizer;
    private final ObjectProvider<MarketDataSource> marketDataSourceProvider;
    private final EngineProperties engineProperties;
    private final TaskExecutor backtestExecutor;
    private final Map<String, BacktestSession> backtests = new ConcurrentHashMap<>();

    public BacktestService(
            StrategyRegistry strategyRegistry,
            StrategyParamValidator strategyParamValidator,
            ExecutionSimulator executionSimulator,
            ObservationNormalizer observationNormalizer,
            ObjectProvider<MarketDataSource> marketDataSourceProvider,
            EngineProperties engineProperties,
            @Qualifier("backtestExecutor") TaskExecutor backtestExecutor
    ) {
        this.strategyRegistry = strategyRegistry;
        this.strategyParamValidator = strategyParamValidator;
        this.executionSimulator = executionSimulator;
        this.observationNormalizer = observationNormalizer;
        this.marketDataSourceProvider = marketDataSourceProvider;
        this.engineProperties = engineProperties;
        this.backtestExecutor = backtestExecutor;
    }

    public BacktestStatusDto load(LoadBacktestRequest request) {
        String symbol = observationNormalizer.normalizeSymbol(request.symbol());
        Duration timeframe = request.timeframe() == null ? engineProperties.timeframe() : request.timeframe();
        if (timeframe.toMillis() <= 0) {
            throw new TradingApiException(HttpStatus.BAD_REQUEST, "invalid_timeframe", "timeframe must be at least 1ms");
        }
        if (!request.startTime().isBefore(request.endTime())) {
            throw new TradingApiException(HttpStatus.BAD_REQUEST, "invalid_range", "startTime must be before endTime");
        }

        StrategyDefinition definition = strategyRegistry.getRequired(request.strategy());
        StrategyParams params = strategyParamValidator.resolve(definition, request.params());
        PlaybackMode playbackMode = request.playbackMode() == null ? engineProperties.playbackMode() : request.playbackMode();
        double playbackRate = request.playbackRate() == null ? engineProperties.playbackRate() : request.playbackRate();
        PlaybackPacer pacer = new PlaybackPacer(playbackMode, timeframe, playbackRate);

        List<Bar> bars = fetchHistory(symbol, timeframe, request.startTime(), request.endTime());

        SessionSettings settings = new SessionSettings(
                ExecutionMode.PAPER,
                symbol,
                timeframe,
                request.initialBalance() == null ? engineProperties.initialBalance() : request.initialBalance(),
                request.commissionRate() == null ? engineProperties.commissionRate() : request.commissionRate(),
                request.orderQuantity() == null ? engineProperties.orderQuantity() : request.orderQuantity(),
                request.allowShort() == null ? engineProperties.allowShort() : request.allowShort()
        );
        String id = UUID.randomUUID().toString();
        TradingSession session = new TradingSession(
                settings,
                new StrategyRuntime(id, definition.name(), params, definition.newInstance()),
                new WalletLedger(settings.initialBalance(), true),
                executionSimulator::execute
        );
        session.start();

        BacktestSession backtest = new BacktestSession(id, bars, session, pacer, request.startTime(), request.endTime());
        backtests.put(id, backtest);
        log.info(
                "event=backtest_loaded id={} symbol={} strategy={} bars={} start={} end={} playback={}",
                id,
                symbol,
                definition.name(),
                bars.size(),
                request.startTime(),
                request.endTime(),
                playbackMode
        );
        return backtest.status();
    }

    public BacktestStatusDto start(String id) {
        BacktestSession backtest = getRequired(id);
        if (backtest.start()) {
            backtestExecutor.execute(backtest::runLoop);
        }
        return backtest.status();
    }

    public BacktestStatusDto pause(String id) {
        BacktestSession backtest = getRequired(id);
        backtest.pause();
        return backtest.status();
    }

    public BacktestStatusDto stop(String id) {
        BacktestSession backtest = getRequired(id);
        backtest.stop();
        return backtest.status();
    }

    public BacktestStatusDto seek(String id, SeekBacktestRequest request) {
        BacktestSession backtest = getRequired(id);
        if (request.index() != null) {
            backtest.seek(request.index());
        } else if (request.time() != null) {
            backtest.seekTo(request.time());
        } else {
            throw new TradingApiException(HttpStatus.BAD_REQUEST, "invalid_seek", "index or time is required");
        }
        return backtest.status();
    }

    public BacktestStatusDto skip(String id, int count) {
        BacktestSession backtest = getRequired(id);
        backtest.skip(count);
        return backtest.status();
    }

    public BacktestStatusDto get(String id) {
        return getRequired(id).status();
    }

    public List<BacktestStatusDto> list() {
        return backtests.values().stream()
                .map(BacktestSession::status)
                .sorted(Comparator.comparing(BacktestStatusDto::startTime).thenComparing(BacktestStatusDto::id))
                .toList();
    }

    public void delete(String id) {
        BacktestSession backtest = getRequired(id);
        backtest.stop();
        backtests.remove(id);
        log.info("event=backtest_deleted id={}", id);
    }

    List<Bar> fetchHistory(String symbol, Duration timeframe, Instant start, Instant end) {
        MarketDataSource source = marketDataSourceProvider.getIfAvailable();
        if (source == null) {
            throw new TradingApiException(
                    HttpStatus.SERVICE_UNAVAILABLE,
                    "market_data_unavailable",
                    "No market data source is configured"
            );
        }

        List<Bar> fetched;
        try {
            fetched = source.fetchHistory(symbol, timeframe, start, end);
        } catch (RuntimeException exception) {
            log.error("event=history_fetch_failed symbol={} start={} end={}", symbol, start, end, exception);
            throw new HistoryFetchException("History fetch failed for " + symbol + ": " + exception.getMessage(), exception);
        }
        if (fetched == null) {
            throw new HistoryFetchException("History fetch returned nothing for " + symbol);
        }

        List<Bar> bars = new ArrayList<>();
        for (Bar bar : fetched) {
            if (bar.openTime().isBefore(start) || !bar.openTime().isBefore(end)) {
                continue;
            }
            if (!symbol.equals(observationNormalizer.normalizeSymbol(bar.symbol()))) {
                throw new HistoryFetchException("History for " + symbol + " contains a bar for " + bar.symbol());
            }
            Bar previous = bars.isEmpty() ? null : bars.get(bars.size() - 1);
            if (previous != null && !bar.openTime().isAfter(previous.openTime())) {
                throw new HistoryFetchException(
                        "History for " + symbol + " is not strictly ascending at " + bar.openTime()
                );
            }
            bars.add(symbol.equals(bar.symbol()) ? bar : withSymbol(bar, symbol));
        }
        if (bars.isEmpty()) {
            throw new HistoryFetchException("No history for " + symbol + " between " + start + " and " + end);
        }
        return bars;
    }

    private Bar withSymbol(Bar bar, String symbol) {
        return new Bar(symbol, bar.timeframe(), bar.openTime(), bar.open(), bar.high(), bar.low(), bar.close(), bar.volume());
    }

    private BacktestSession getRequired(String id) {
        BacktestSession backtest = backtests.get(id);
        if (backtest == null) {
            throw new TradingApiException(HttpStatus.NOT_FOUND, "backtest_not_found", "No backtest for id=" + id);
        }
        return backtest;
    }
}
