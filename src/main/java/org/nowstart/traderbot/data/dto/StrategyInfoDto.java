package org.nowstart.traderbot.data.dto;

import java.util.List;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyOption;

public record StrategyInfoDto(
        String name,
        String description,
        List<StrategyOption> options
) {

    public static StrategyInfoDto from(StrategyDefinition definition) {
        return new StrategyInfoDto(definition.name(), definition.description(), List.copyOf(definition.options()));
    }
}
