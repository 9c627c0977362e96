package org.nowstart.traderbot.market;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.nowstart.traderbot.data.dto.Bar;

/**
 * The aggregator's open bar. Never leaves the aggregator; callers only see {@link #toBar()} copies.
 */
final class MutableBar {

    private final String symbol;
    private final Duration timeframe;
    private final Instant openTime;
    private final BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;

    MutableBar(String symbol, Duration timeframe, Instant openTime, BigDecimal price, BigDecimal quantity) {
        this.symbol = symbol;
        this.timeframe = timeframe;
        this.openTime = openTime;
        this.open = price;
        this.high = price;
        this.low = price;
        this.close = price;
        this.volume = quantity;
    }

    void update(BigDecimal price, BigDecimal quantity) {
        high = high.max(price);
        low = low.min(price);
        close = price;
        volume = volume.add(quantity);
    }

    Instant openTime() {
        return openTime;
    }

    Bar toBar() {
        return new Bar(symbol, timeframe, openTime, open, high, low, close, volume);
    }
}
