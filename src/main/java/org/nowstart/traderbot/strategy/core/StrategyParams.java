package org.nowstart.traderbot.strategy.core;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated strategy parameters. Values are already converted to the option's type: {@link Integer},
 * {@link BigDecimal}, {@link Boolean} or {@link String}.
 */
public final class StrategyParams {

    private final Map<String, Object> values;

    public StrategyParams(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int getInt(String name) {
        return ((Number) required(name)).intValue();
    }

    public BigDecimal getDecimal(String name) {
        Object value = required(name);
        return value instanceof BigDecimal decimal ? decimal : new BigDecimal(value.toString());
    }

    public double getDouble(String name) {
        return ((Number) required(name)).doubleValue();
    }

    public boolean getBoolean(String name) {
        return (Boolean) required(name);
    }

    public String getString(String name) {
        return required(name).toString();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object required(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No value for strategy option " + name);
        }
        return value;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof StrategyParams params && values.equals(params.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
