package org.nowstart.traderbot.strategy.macd;

import java.util.List;
import java.util.Map;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.indicator.Indicator;
import org.nowstart.traderbot.indicator.MovingAverageConvergenceDivergence;
import org.nowstart.traderbot.indicator.MovingAverageConvergenceDivergence.Component;
import org.nowstart.traderbot.strategy.core.Crossover;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;

public class MacdCrossoverStrategy implements TradingStrategy {

    private int fastPeriod;
    private int slowPeriod;
    private int signalPeriod;
    private double previousLine = Double.NaN;
    private double previousSignal = Double.NaN;

    @Override
    public void onStart(StrategyParams params) {
        fastPeriod = params.getInt(MacdCrossoverDefinition.FAST_PERIOD);
        slowPeriod = params.getInt(MacdCrossoverDefinition.SLOW_PERIOD);
        signalPeriod = params.getInt(MacdCrossoverDefinition.SIGNAL_PERIOD);
    }

    @Override
    public List<Indicator> indicators() {
        return List.of(
                new MovingAverageConvergenceDivergence(fastPeriod, slowPeriod, signalPeriod, Component.LINE),
                new MovingAverageConvergenceDivergence(fastPeriod, slowPeriod, signalPeriod, Component.SIGNAL)
        );
    }

    @Override
    public Signal onBar(Bar bar, Map<String, Double> indicators) {
        double line = indicators.getOrDefault(
                MovingAverageConvergenceDivergence.key(Component.LINE, fastPeriod, slowPeriod, signalPeriod),
                Double.NaN
        );
        double signalLine = indicators.getOrDefault(
                MovingAverageConvergenceDivergence.key(Component.SIGNAL, fastPeriod, slowPeriod, signalPeriod),
                Double.NaN
        );

        Signal signal = Signal.hold(bar.symbol());
        if (Crossover.crossedAbove(previousLine, previousSignal, line, signalLine)) {
            signal = Signal.buy(bar.symbol(), "MACD crossed above signal line");
        } else if (Crossover.crossedBelow(previousLine, previousSignal, line, signalLine)) {
            signal = Signal.sell(bar.symbol(), "MACD crossed below signal line");
        }
        previousLine = line;
        previousSignal = signalLine;
        return signal;
    }
}
