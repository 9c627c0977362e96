package org.nowstart.traderbot.strategy;

import jakarta.annotation.PostConstruct;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.traderbot.data.dto.StrategyInfoDto;
import org.nowstart.traderbot.data.exception.TradingApiException;
import org.nowstart.traderbot.strategy.core.StrategyDefinition;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyRegistry {

    private final List<StrategyDefinition> definitions;
    private Map<String, StrategyDefinition> definitionsByName = Map.of();

    @PostConstruct
    public void init() {
        Map<String, StrategyDefinition> byName = new HashMap<>();
        for (StrategyDefinition definition : definitions) {
            String name = normalize(definition.name());
            StrategyDefinition previous = byName.put(name, definition);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy registered for name=" + name);
            }
        }
        definitionsByName = Map.copyOf(byName);
    }

    public StrategyDefinition getRequired(String strategyName) {
        StrategyDefinition definition = definitionsByName.get(normalize(strategyName));
        if (definition == null) {
            throw new TradingApiException(
                    HttpStatus.NOT_FOUND,
                    "strategy_not_found",
                    "No strategy registered for name=" + strategyName
            );
        }
        return definition;
    }

    public List<StrategyInfoDto> describe() {
        return definitionsByName.values().stream()
                .sorted(Comparator.comparing(StrategyDefinition::name))
                .map(StrategyInfoDto::from)
                .toList();
    }

    private String normalize(String strategyName) {
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("strategy name is required");
        }
        return strategyName.trim().toLowerCase(Locale.ROOT);
    }
}
