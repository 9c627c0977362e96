package org.nowstart.traderbot.strategy.ma;

import java.util.List;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyOption;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;
import org.springframework.stereotype.Component;

@Component
public class MovingAverageCrossoverDefinition implements StrategyDefinition {

    public static final String NAME = "ma_crossover";
    public static final String FAST_PERIOD = "fast_period";
    public static final String SLOW_PERIOD = "slow_period";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Buys when the fast SMA crosses above the slow SMA and sells when it crosses below.";
    }

    @Override
    public List<StrategyOption> options() {
        return List.of(
                StrategyOption.integer(FAST_PERIOD, 20, 1, null, "fast SMA period"),
                StrategyOption.integer(SLOW_PERIOD, 50, 2, null, "slow SMA period")
        );
    }

    @Override
    public TradingStrategy newInstance() {
        return new MovingAverageCrossoverStrategy();
    }

    @Override
    public List<String> validate(StrategyParams params) {
        if (params.getInt(FAST_PERIOD) >= params.getInt(SLOW_PERIOD)) {
            return List.of(FAST_PERIOD + " must be less than " + SLOW_PERIOD);
        }
        return List.of();
    }
}
