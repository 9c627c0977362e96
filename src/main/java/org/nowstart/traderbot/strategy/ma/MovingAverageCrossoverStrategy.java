package org.nowstart.traderbot.strategy.ma;

import java.util.List;
import java.util.Map;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.indicator.Indicator;
import org.nowstart.traderbot.indicator.SimpleMovingAverage;
import org.nowstart.traderbot.strategy.core.Crossover;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;

public class MovingAverageCrossoverStrategy implements TradingStrategy {

    private int fastPeriod;
    private int slowPeriod;
    private double previousFast = Double.NaN;
    private double previousSlow = Double.NaN;

    @Override
    public void onStart(StrategyParams params) {
        fastPeriod = params.getInt(MovingAverageCrossoverDefinition.FAST_PERIOD);
        slowPeriod = params.getInt(MovingAverageCrossoverDefinition.SLOW_PERIOD);
    }

    @Override
    public List<Indicator> indicators() {
        return List.of(new SimpleMovingAverage(fastPeriod), new SimpleMovingAverage(slowPeriod));
    }

    @Override
    public Signal onBar(Bar bar, Map<String, Double> indicators) {
        String fastKey = SimpleMovingAverage.key(fastPeriod);
        String slowKey = SimpleMovingAverage.key(slowPeriod);
        double fast = indicators.getOrDefault(fastKey, Double.NaN);
        double slow = indicators.getOrDefault(slowKey, Double.NaN);

        Signal signal = Signal.hold(bar.symbol());
        if (Crossover.crossedAbove(previousFast, previousSlow, fast, slow)) {
            signal = Signal.buy(bar.symbol(), fastKey + " crossed above " + slowKey);
        } else if (Crossover.crossedBelow(previousFast, previousSlow, fast, slow)) {
            signal = Signal.sell(bar.symbol(), fastKey + " crossed below " + slowKey);
        }
        previousFast = fast;
        previousSlow = slow;
        return signal;
    }
}
