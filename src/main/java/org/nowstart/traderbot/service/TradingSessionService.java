package org.nowstart.traderbot.service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.AccountInfo;
import org.nowstart.traderbot.data.dto.LedgerSnapshot;
import org.nowstart.traderbot.data.dto.SessionSettings;
import org.nowstart.traderbot.data.dto.SessionStatusDto;
import org.nowstart.traderbot.data.dto.StartSessionRequest;
import org.nowstart.traderbot.data.dto.TradeRecord;
import org.nowstart.traderbot.data.exception.OrderSinkException;
import org.nowstart.traderbot.data.exception.StateConflictException;
import org.nowstart.traderbot.data.exception.TradingApiException;
import org.nowstart.traderbot.data.property.EngineProperties;
import org.nowstart.traderbot.data.type.ExecutionMode;
import org.nowstart.traderbot.gateway.MarketDataSource;
import org.nowstart.traderbot.ledger.WalletLedger;
import org.nowstart.traderbot.market.ObservationNormalizer;
import org.nowstart.traderbot.market.SymbolPipeline;
import org.nowstart.traderbot.session.SessionKey;
import org.nowstart.traderbot.session.TradingSession;
import org.nowstart.traderbot.strategy.StrategyParamValidator;
import org.nowstart.traderbot.strategy.StrategyRegistry;
import org.nowstart.traderbot.strategy.StrategyRuntime;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradingSessionService {

    private final StrategyRegistry strategyRegistry;
    private final StrategyParamValidator strategyParamValidator;
    private final ExecutionService executionService;
    private final OrderRouter orderRouter;
    private final ObservationNormalizer observationNormalizer;
    private final ObjectProvider<MarketDataSource> marketDataSourceProvider;
    private final EngineProperties engineProperties;
    private final Clock clock;
    private final Map<SessionKey, SymbolPipeline> pipelines = new ConcurrentHashMap<>();

    public SessionStatusDto start(StartSessionRequest request) {
        ExecutionMode mode = request.mode() == null ? engineProperties.executionMode() : request.mode();
        String symbol = observationNormalizer.normalizeSymbol(request.symbol());
        SessionKey key = new SessionKey(mode, symbol);

        StrategyDefinition definition = strategyRegistry.getRequired(request.strategy());
        StrategyParams params = strategyParamValidator.resolve(definition, request.params());
        SessionSettings settings = resolveSettings(mode, symbol, request);

        MarketDataSource marketDataSource = requireMarketDataSource();
        if (mode == ExecutionMode.LIVE) {
            orderRouter.requireOrderSink();
        }

        synchronized (pipelines) {
            SymbolPipeline existing = pipelines.get(key);
            if (existing != null && existing.session().isRunning()) {
                throw new StateConflictException(
                        "A strategy is already running for " + key + ": " + existing.session().runtime().getId()
                );
            }

            StrategyRuntime runtime = new StrategyRuntime(
                    UUID.randomUUID().toString(),
                    definition.name(),
                    params,
                    definition.newInstance()
            );
            WalletLedger ledger = new WalletLedger(settings.initialBalance(), mode == ExecutionMode.PAPER);
            TradingSession session = new TradingSession(settings, runtime, ledger, executionService);
            session.start();

            SymbolPipeline pipeline = new SymbolPipeline(
                    session,
                    observationNormalizer,
                    engineProperties.ingestQueueCapacity(),
                    clock,
                    this::onSessionFault
            );
            try {
                pipeline.start(marketDataSource);
            } catch (RuntimeException exception) {
                pipeline.stop();
                log.error("event=session_start_failed session={} reason={}", key, exception.getMessage(), exception);
                throw new TradingApiException(
                        HttpStatus.BAD_GATEWAY,
                        "market_data_error",
                        "Subscription failed for " + symbol + ": " + exception.getMessage(),
                        exception
                );
            }
            pipelines.put(key, pipeline);
            return session.status();
        }
    }

    public SessionStatusDto stop(ExecutionMode mode, String symbol) {
        SymbolPipeline pipeline = requirePipeline(mode, symbol);
        pipeline.stop();
        return pipeline.session().status();
    }

    public List<SessionStatusDto> list() {
        return pipelines.values().stream()
                .map(pipeline -> pipeline.session().status())
                .sorted(Comparator.comparing(SessionStatusDto::mode).thenComparing(SessionStatusDto::symbol))
                .toList();
    }

    public LedgerSnapshot ledger(ExecutionMode mode, String symbol) {
        return requirePipeline(mode, symbol).session().ledgerSnapshot();
    }

    public int reconcilePendingOrders() {
        int completed = 0;
        for (SymbolPipeline pipeline : pipelines.values()) {
            TradingSession session = pipeline.session();
            if (session.settings().mode() == ExecutionMode.LIVE && !session.pendingOrders().isEmpty()) {
                completed += orderRouter.reconcile(session, clock.instant());
            }
        }
        return completed;
    }

    public AccountInfo account() {
        try {
            return orderRouter.requireOrderSink().getAccountInfo();
        } catch (TradingApiException exception) {
            throw exception;
        } catch (RuntimeException exception) {
            throw new OrderSinkException("Account lookup failed: " + exception.getMessage(), exception);
        }
    }

    public List<TradeRecord> trades(String symbol) {
        String normalized = observationNormalizer.normalizeSymbol(symbol);
        try {
            return orderRouter.requireOrderSink().getTradeHistory(normalized);
        } catch (TradingApiException exception) {
            throw exception;
        } catch (RuntimeException exception) {
            throw new OrderSinkException("Trade history lookup failed for " + normalized + ": " + exception.getMessage(), exception);
        }
    }

    @PreDestroy
    public void shutdown() {
        pipelines.values().stream()
                .filter(pipeline -> pipeline.session().isRunning())
                .forEach(SymbolPipeline::stop);
    }

    private void onSessionFault(TradingSession session) {
        log.error(
                "event=session_terminated session={} instance={} fault={}",
                session.key(),
                session.runtime().getId(),
                session.runtime().getFaultReason()
        );
    }

    private SymbolPipeline requirePipeline(ExecutionMode mode, String symbol) {
        SessionKey key = new SessionKey(mode, observationNormalizer.normalizeSymbol(symbol));
        SymbolPipeline pipeline = pipelines.get(key);
        if (pipeline == null) {
            throw new TradingApiException(HttpStatus.NOT_FOUND, "session_not_found", "No session for " + key);
        }
        return pipeline;
    }

    private MarketDataSource requireMarketDataSource() {
        MarketDataSource source = marketDataSourceProvider.getIfAvailable();
        if (source == null) {
            throw new TradingApiException(
                    HttpStatus.SERVICE_UNAVAILABLE,
                    "market_data_unavailable",
                    "No market data source is configured"
            );
        }
        return source;
    }

    private SessionSettings resolveSettings(ExecutionMode mode, String symbol, StartSessionRequest request) {
        Duration timeframe = request.timeframe() == null ? engineProperties.timeframe() : request.timeframe();
        if (timeframe.toMillis() <= 0) {
            throw new TradingApiException(HttpStatus.BAD_REQUEST, "invalid_timeframe", "timeframe must be at least 1ms");
        }
        return new SessionSettings(
                mode,
                symbol,
                timeframe,
                request.initialBalance() == null ? engineProperties.initialBalance() : request.initialBalance(),
                request.commissionRate() == null ? engineProperties.commissionRate() : request.commissionRate(),
                request.orderQuantity() == null ? engineProperties.orderQuantity() : request.orderQuantity(),
                request.allowShort() == null ? engineProperties.allowShort() : request.allowShort()
        );
    }
}
