package org.nowstart.traderbot.strategy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.nowstart.traderbot.data.exception.InvalidParametersException;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.nowstart.traderbot.strategy.core.StrategyOption;
import org.nowstart.traderbot.strategy.core.StrategyParams;
import org.springframework.stereotype.Component;

/**
 * Resolves raw request parameters against a strategy's declared options. Every violation is collected before
 * failing, so callers see the full list at once.
 */
@Component
public class StrategyParamValidator {

    public StrategyParams resolve(StrategyDefinition definition, Map<String, ?> raw) {
        Map<String, ?> input = raw == null ? Map.of() : raw;
        List<String> violations = new ArrayList<>();
        Map<String, Object> resolved = new LinkedHashMap<>();

        Set<String> known = definition.options().stream()
                .map(StrategyOption::name)
                .collect(Collectors.toSet());
        input.keySet().stream()
                .filter(name -> !known.contains(name))
                .sorted()
                .forEach(name -> violations.add("unknown option " + name));

        for (StrategyOption option : definition.options()) {
            Object value = input.containsKey(option.name()) ? input.get(option.name()) : option.defaultValue();
            if (value == null) {
                violations.add(option.name() + " is required");
                continue;
            }
            Object converted = convert(option, value);
            if (converted == null) {
                violations.add(option.name() + " must be of type " + option.type() + " but was " + value);
                continue;
            }
            String rangeViolation = checkRange(option, converted);
            if (rangeViolation != null) {
                violations.add(rangeViolation);
                continue;
            }
            resolved.put(option.name(), converted);
        }

        if (violations.isEmpty()) {
            violations.addAll(definition.validate(new StrategyParams(resolved)));
        }
        if (!violations.isEmpty()) {
            throw new InvalidParametersException(definition.name(), violations);
        }
        return new StrategyParams(resolved);
    }

    private Object convert(StrategyOption option, Object value) {
        return switch (option.type()) {
            case INTEGER -> toInteger(value);
            case DECIMAL -> toDecimal(value);
            case BOOLEAN -> toBoolean(value);
            case STRING -> value instanceof String ? value : null;
        };
    }

    private Integer toInteger(Object value) {
        BigDecimal decimal = toDecimal(value);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.intValueExact();
        } catch (ArithmeticException exception) {
            return null;
        }
    }

    private BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Integer || value instanceof Long) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            return Double.isFinite(asDouble) ? BigDecimal.valueOf(asDouble) : null;
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException exception) {
                return null;
            }
        }
        return null;
    }

    private Boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    private String checkRange(StrategyOption option, Object value) {
        if (!(value instanceof Number number)) {
            return null;
        }
        BigDecimal decimal = number instanceof BigDecimal big ? big : BigDecimal.valueOf(number.longValue());
        if (option.min() != null && decimal.compareTo(option.min()) < 0) {
            return option.name() + " must be >= " + option.min().toPlainString() + " but was " + decimal.toPlainString();
        }
        if (option.max() != null && decimal.compareTo(option.max()) > 0) {
            return option.name() + " must be <= " + option.max().toPlainString() + " but was " + decimal.toPlainString();
        }
        return null;
    }
}
