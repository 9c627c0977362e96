package org.nowstart.traderbot.strategy.rsi;

import java.util.List;
import java.util.Map;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.indicator.Indicator;
import org.nowstart.traderbot.indicator.RelativeStrengthIndex;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;

public class RsiThresholdStrategy implements TradingStrategy {

    private int period;
    private double oversold;
    private double overbought;
    private double previousRsi = Double.NaN;

    @Override
    public void onStart(StrategyParams params) {
        period = params.getInt(RsiThresholdDefinition.RSI_PERIOD);
        oversold = params.getDouble(RsiThresholdDefinition.OVERSOLD);
        overbought = params.getDouble(RsiThresholdDefinition.OVERBOUGHT);
    }

    @Override
    public List<Indicator> indicators() {
        return List.of(new RelativeStrengthIndex(period));
    }

    @Override
    public Signal onBar(Bar bar, Map<String, Double> indicators) {
        double rsi = indicators.getOrDefault(RelativeStrengthIndex.key(period), Double.NaN);
        double previous = previousRsi;
        previousRsi = rsi;
        if (Double.isNaN(previous) || Double.isNaN(rsi)) {
            return Signal.hold(bar.symbol());
        }

        if (previous < oversold && rsi >= oversold) {
            return Signal.buy(bar.symbol(), "RSI crossed above oversold level (" + oversold + ")");
        }
        if (previous > overbought && rsi <= overbought) {
            return Signal.sell(bar.symbol(), "RSI crossed below overbought level (" + overbought + ")");
        }
        return Signal.hold(bar.symbol());
    }
}
