package org.nowstart.traderbot.indicator;

import org.nowstart.traderbot.data.dto.Bar;

/**
 * Incremental technical indicator fed one sealed bar at a time.
 *
 * <p>Implementations keep only the rolling state they need, so every {@link #update(Bar)} call is O(1)
 * amortized and a long replay stays linear in the number of bars. A value that is not yet defined
 * (warm-up) is reported as {@link Double#NaN}.
 */
public interface Indicator {

    /**
     * Stable key made of the indicator name and its parameters, for example {@code sma_20} or {@code rsi_14}.
     *
     * @return key under which the engine stores the series
     */
    String key();

    /**
     * Consumes the next sealed bar.
     *
     * @param bar sealed bar, delivered in ascending open time
     * @return indicator value for this bar, or {@link Double#NaN} while undefined
     */
    double update(Bar bar);
}
