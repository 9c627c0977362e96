package org.nowstart.traderbot.strategy.rsi;

import java.util.List;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyOption;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.nowstart.traderbot.strategy.core.TradingStrategy;
import org.springframework.stereotype.Component;

@Component
public class RsiThresholdDefinition implements StrategyDefinition {

    public static final String NAME = "rsi";
    public static final String RSI_PERIOD = "rsi_period";
    public static final String OVERSOLD = "oversold";
    public static final String OVERBOUGHT = "overbought";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Buys when RSI climbs back above the oversold level and sells when it falls back below the overbought level.";
    }

    @Override
    public List<StrategyOption> options() {
        return List.of(
                StrategyOption.integer(RSI_PERIOD, 14, 2, null, "RSI lookback period"),
                StrategyOption.decimal(OVERSOLD, "30", "0", "100", "oversold level"),
                StrategyOption.decimal(OVERBOUGHT, "70", "0", "100", "overbought level")
        );
    }

    @Override
    public TradingStrategy newInstance() {
        return new RsiThresholdStrategy();
    }

    @Override
    public List<String> validate(StrategyParams params) {
        if (params.getDecimal(OVERSOLD).compareTo(params.getDecimal(OVERBOUGHT)) >= 0) {
            return List.of(OVERSOLD + " must be less than " + OVERBOUGHT);
        }
        return List.of();
    }
}
