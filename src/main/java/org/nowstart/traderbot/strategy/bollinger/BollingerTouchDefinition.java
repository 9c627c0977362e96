package org.nowstart.traderbot.strategy.bollinger;

import java.util.List;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyOption;
import org.nowstart.traderbot.strategy.core.TradingStrategy;
import org.springframework.stereotype.Component;

@Component
public class BollingerTouchDefinition implements StrategyDefinition {

    public static final String NAME = "bollinger";
    public static final String PERIOD = "period";
    public static final String STD_DEV = "std_dev";
    public static final String BAND_TOUCH_PCT = "band_touch_pct";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Buys when the close touches the lower Bollinger band and sells when it touches the upper band.";
    }

    @Override
    public List<StrategyOption> options() {
        return List.of(
                StrategyOption.integer(PERIOD, 20, 2, null, "band lookback period"),
                StrategyOption.decimal(STD_DEV, "2.0", "0", null, "band width in standard deviations"),
                // distance to a band, in percent of the close, that still counts as touching it
                StrategyOption.decimal(BAND_TOUCH_PCT, "0.5", "0", "100", "touch tolerance in percent of close")
        );
    }

    @Override
    public TradingStrategy newInstance() {
        return new BollingerTouchStrategy();
    }
}
