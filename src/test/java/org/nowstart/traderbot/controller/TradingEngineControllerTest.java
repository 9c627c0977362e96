package org.nowstart.traderbot.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.traderbot.data.dto.AccountInfo;
import org.nowstart.traderbot.data.dto.LedgerSnapshot;
import org.nowstart.traderbot.data.dto.SessionStatusDto;
import org.nowstart.traderbot.data.dto.StartSessionRequest;
import org.nowstart.traderbot.data.dto.StrategyInfoDto;
import org.nowstart.traderbot.data.dto.TradeRecord;
import org.nowstart.traderbot.data.type.ExecutionMode;
import org.nowstart.traderbot.data.type.StrategyState;
import org.nowstart.traderbot.service.TradingSessionService;
import org.nowstart.traderbot.strategy.StrategyRegistry;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class TradingEngineControllerTest {

    @Mock
    private StrategyRegistry strategyRegistry;

    @Mock
    private TradingSessionService tradingSessionService;

    @InjectMocks
    private TradingEngineController controller;

    @Test
    void getStrategies_delegatesToRegistry() {
        List<StrategyInfoDto> strategies = List.of(new StrategyInfoDto("rsi", "RSI thresholds", List.of()));
        when(strategyRegistry.describe()).thenReturn(strategies);

        assertThat(controller.getStrategies()).isEqualTo(strategies);
    }

    @Test
    void startSession_returnsCreatedResponse() {
        StartSessionRequest request = new StartSessionRequest(
                ExecutionMode.PAPER, "BTCUSDT", "rsi", Map.of(), null, null, null, null, null
        );
        SessionStatusDto status = status(StrategyState.RUNNING);
        when(tradingSessionService.start(request)).thenReturn(status);

        var response = controller.startSession(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isEqualTo(status);
    }

    @Test
    void stopSession_delegatesToService() {
        SessionStatusDto status = status(StrategyState.STOPPED);
        when(tradingSessionService.stop(ExecutionMode.PAPER, "BTCUSDT")).thenReturn(status);

        assertThat(controller.stopSession(ExecutionMode.PAPER, "BTCUSDT")).isEqualTo(status);
    }

    @Test
    void getSessions_delegatesToService() {
        List<SessionStatusDto> sessions = List.of(status(StrategyState.RUNNING));
        when(tradingSessionService.list()).thenReturn(sessions);

        assertThat(controller.getSessions()).isEqualTo(sessions);
    }

    @Test
    void getLedger_delegatesToService() {
        LedgerSnapshot snapshot = new LedgerSnapshot(
                new BigDecimal("1000"), new BigDecimal("1000"), BigDecimal.ZERO, List.of(), List.of(), List.of()
        );
        when(tradingSessionService.ledger(ExecutionMode.PAPER, "BTCUSDT")).thenReturn(snapshot);

        assertThat(controller.getLedger(ExecutionMode.PAPER, "BTCUSDT")).isEqualTo(snapshot);
    }

    @Test
    void getAccountAndTrades_delegateToService() {
        AccountInfo account = new AccountInfo(true, List.of());
        List<TradeRecord> trades = List.of();
        when(tradingSessionService.account()).thenReturn(account);
        when(tradingSessionService.trades("BTCUSDT")).thenReturn(trades);

        assertThat(controller.getAccount()).isEqualTo(account);
        assertThat(controller.getTrades("BTCUSDT")).isEqualTo(trades);
        verify(tradingSessionService).trades("BTCUSDT");
    }

    private SessionStatusDto status(StrategyState state) {
        return new SessionStatusDto(
                "instance-1",
                ExecutionMode.PAPER,
                "BTCUSDT",
                "rsi",
                Map.of("rsi_period", 14),
                state,
                null,
                Instant.parse("2026-01-01T00:00:00Z"),
                0,
                null,
                null,
                null,
                0,
                new BigDecimal("1000"),
                BigDecimal.ZERO,
                new BigDecimal("1000")
        );
    }
}
