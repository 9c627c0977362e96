package org.nowstart.traderbot.strategy.macd;

import java.util.List;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyOption;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;
import org.springframework.stereotype.Component;

@Component
public class MacdCrossoverDefinition implements StrategyDefinition {

    public static final String NAME = "macd";
    public static final String FAST_PERIOD = "fast_period";
    public static final String SLOW_PERIOD = "slow_period";
    public static final String SIGNAL_PERIOD = "signal_period";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Buys when the MACD line crosses above its signal line and sells when it crosses below.";
    }

    @Override
    public List<StrategyOption> options() {
        return List.of(
                StrategyOption.integer(FAST_PERIOD, 12, 1, null, "fast EMA period"),
                StrategyOption.integer(SLOW_PERIOD, 26, 2, null, "slow EMA period"),
                StrategyOption.integer(SIGNAL_PERIOD, 9, 1, null, "signal line EMA period")
        );
    }

    @Override
    public TradingStrategy newInstance() {
        return new MacdCrossoverStrategy();
    }

    @Override
    public List<String> validate(StrategyParams params) {
        if (params.getInt(FAST_PERIOD) >= params.getInt(SLOW_PERIOD)) {
            return List.of(FAST_PERIOD + " must be less than " + SLOW_PERIOD);
        }
        return List.of();
    }
}
