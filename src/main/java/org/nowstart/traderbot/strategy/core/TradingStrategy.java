package org.nowstart.traderbot.strategy.core;

import java.util.List;
import java.util.Map;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.indicator.Indicator;

/**
 * A single strategy instance. Instances are created per session by a {@link StrategyDefinition} and receive
 * sealed bars strictly in order, one at a time.
 */
public interface TradingStrategy {

    /**
     * Called once with validated parameters before the first bar.
     */
    void onStart(StrategyParams params);

    /**
     * Indicators this instance reads. They are registered with the session's indicator engine after
     * {@link #onStart(StrategyParams)} and before the first bar.
     */
    default List<Indicator> indicators() {
        return List.of();
    }

    /**
     * @param bar        the bar that was just sealed
     * @param indicators indicator values for this bar keyed by indicator key; NaN means undefined
     * @return the signal for this bar, never {@code null}
     */
    Signal onBar(Bar bar, Map<String, Double> indicators);

    default void onStop() {
    }
}
