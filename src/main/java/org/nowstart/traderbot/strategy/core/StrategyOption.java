package org.nowstart.traderbot.strategy.core;

import java.math.BigDecimal;
import org.nowstart.traderbot.data.type.OptionType;

public record StrategyOption(
        String name,
        OptionType type,
        Object defaultValue,
        BigDecimal min,
        BigDecimal max,
        String description
) {

    public static StrategyOption integer(String name, int defaultValue, int min, Integer max, String description) {
        return new StrategyOption(
                name,
                OptionType.INTEGER,
                defaultValue,
                BigDecimal.valueOf(min),
                max == null ? null : BigDecimal.valueOf(max),
                description
        );
    }

    public static StrategyOption decimal(String name, String defaultValue, String min, String max, String description) {
        return new StrategyOption(
                name,
                OptionType.DECIMAL,
                new BigDecimal(defaultValue),
                min == null ? null : new BigDecimal(min),
                max == null ? null : new BigDecimal(max),
                description
        );
    }

    public boolean required() {
        return defaultValue == null;
    }
}
