package org.nowstart.traderbot.strategy.core;

import java.util.List;

public interface StrategyDefinition {

    String name();

    String description();

    List<StrategyOption> options();

    TradingStrategy newInstance();

    /**
     * Rules spanning more than one option. Only called once every option has a value of the right type.
     */
    default List<String> validate(StrategyParams params) {
        return List.of();
    }
}
