package org.nowstart.traderbot.strategy.bollinger;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.indicator.BollingerBands;
import org.nowstart.traderbot.indicator.BollingerBands.Component;
import org.nowstart.traderbot.indicator.Indicator;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;

public class BollingerTouchStrategy implements TradingStrategy {

    private int period;
    private double stdDev;
    private double bandTouchPct;

    @Override
    public void onStart(StrategyParams params) {
        period = params.getInt(BollingerTouchDefinition.PERIOD);
        stdDev = params.getDouble(BollingerTouchDefinition.STD_DEV);
        bandTouchPct = params.getDouble(BollingerTouchDefinition.BAND_TOUCH_PCT);
    }

    @Override
    public List<Indicator> indicators() {
        return List.of(
                new BollingerBands(period, stdDev, Component.UPPER),
                new BollingerBands(period, stdDev, Component.LOWER)
        );
    }

    @Override
    public Signal onBar(Bar bar, Map<String, Double> indicators) {
        double upper = indicators.getOrDefault(BollingerBands.key(Component.UPPER, period, stdDev), Double.NaN);
        double lower = indicators.getOrDefault(BollingerBands.key(Component.LOWER, period, stdDev), Double.NaN);
        double close = bar.close().doubleValue();
        if (Double.isNaN(upper) || Double.isNaN(lower) || close <= 0.0) {
            return Signal.hold(bar.symbol());
        }

        double lowerDistancePct = (close - lower) / close * 100.0;
        double upperDistancePct = (upper - close) / close * 100.0;
        if (lowerDistancePct <= bandTouchPct) {
            return Signal.buy(bar.symbol(), String.format(Locale.ROOT, "Price touched lower band (distance: %.2f%%)", lowerDistancePct));
        }
        if (upperDistancePct <= bandTouchPct) {
            return Signal.sell(bar.symbol(), String.format(Locale.ROOT, "Price touched upper band (distance: %.2f%%)", upperDistancePct));
        }
        return Signal.hold(bar.symbol());
    }
}
