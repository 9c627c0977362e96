package org.nowstart.traderbot.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.data.exception.StateConflictException;
import org.nowstart.traderbot.data.exception.StrategyFaultException;
import org.nowstart.traderbot.data.type.StrategyState;
import org.nowstart.traderbot.indicator.SimpleMovingAverage;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;
import org.nowstart.traderbot.support.TestBars;

@ExtendWith(MockitoExtension.class)
class StrategyRuntimeTest {

    private static final StrategyParams PARAMS = new StrategyParams(Map.of("period", 3));

    @Mock
    private TradingStrategy strategy;

    @Test
    void start_movesToRunningAndReturnsIndicators() {
        when(strategy.indicators()).thenReturn(List.of(new SimpleMovingAverage(3)));
        StrategyRuntime runtime = new StrategyRuntime("id-1", "sma", PARAMS, strategy);

        assertThat(runtime.start()).extracting(indicator -> indicator.key()).containsExactly("sma_3");
        assertThat(runtime.getState()).isEqualTo(StrategyState.RUNNING);
        verify(strategy).onStart(PARAMS);
    }

    @Test
    void start_rejectsSecondStart() {
        StrategyRuntime runtime = new StrategyRuntime("id-1", "sma", PARAMS, strategy);
        runtime.start();

        assertThatThrownBy(runtime::start).isInstanceOf(StateConflictException.class);
    }

    @Test
    void onBar_returnsStrategySignal() {
        when(strategy.onBar(any(), any())).thenReturn(Signal.buy(TestBars.SYMBOL, "up"));
        StrategyRuntime runtime = new StrategyRuntime("id-1", "sma", PARAMS, strategy);
        runtime.start();

        Signal signal = runtime.onBar(TestBars.bar(0, "100"), Map.of());

        assertThat(signal.reason()).isEqualTo("up");
        assertThat(runtime.isRunning()).isTrue();
    }

    @Test
    void onBar_faultsWhenStrategyThrows() {
        when(strategy.onBar(any(), any())).thenThrow(new IllegalStateException("boom"));
        StrategyRuntime runtime = new StrategyRuntime("id-1", "sma", PARAMS, strategy);
        runtime.start();

        assertThatThrownBy(() -> runtime.onBar(TestBars.bar(0, "100"), Map.of()))
                .isInstanceOf(StrategyFaultException.class)
                .hasMessageContaining("boom")
                .hasFieldOrPropertyWithValue("code", "strategy_fault");

        assertThat(runtime.getState()).isEqualTo(StrategyState.STOPPED);
        assertThat(runtime.getFaultReason()).isEqualTo("IllegalStateException: boom");
        assertThatThrownBy(() -> runtime.onBar(TestBars.bar(1, "100"), Map.of())).isInstanceOf(StateConflictException.class);
    }

    @Test
    void onBar_faultsOnMissingOrForeignSignal() {
        when(strategy.onBar(any(), any())).thenReturn(null);
        StrategyRuntime nullRuntime = new StrategyRuntime("id-1", "sma", PARAMS, strategy);
        nullRuntime.start();

        assertThatThrownBy(() -> nullRuntime.onBar(TestBars.bar(0, "100"), Map.of())).isInstanceOf(StrategyFaultException.class);

        when(strategy.onBar(any(), any())).thenReturn(Signal.sell("ETHUSDT", "wrong"));
        StrategyRuntime foreignRuntime = new StrategyRuntime("id-2", "sma", PARAMS, strategy);
        foreignRuntime.start();

        assertThatThrownBy(() -> foreignRuntime.onBar(TestBars.bar(0, "100"), Map.of()))
                .isInstanceOf(StrategyFaultException.class)
                .hasMessageContaining("ETHUSDT");
    }

    @Test
    void stop_isIdempotentAndTolerantOfStopFailure() {
        doThrow(new IllegalStateException("close failed")).when(strategy).onStop();
        StrategyRuntime runtime = new StrategyRuntime("id-1", "sma", PARAMS, strategy);
        runtime.start();

        runtime.stop();
        runtime.stop();

        assertThat(runtime.getState()).isEqualTo(StrategyState.STOPPED);
        verify(strategy).onStop();
    }

    @Test
    void stop_beforeStartSkipsStrategyCallback() {
        StrategyRuntime runtime = new StrategyRuntime("id-1", "sma", PARAMS, strategy);

        runtime.stop();

        verify(strategy, never()).onStop();
        assertThatThrownBy(runtime::start).isInstanceOf(StateConflictException.class);
    }
}
