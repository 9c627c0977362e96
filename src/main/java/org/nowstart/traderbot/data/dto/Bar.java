package org.nowstart.traderbot.data.dto;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Sealed OHLC bar. Instances are immutable; the open bar lives inside the aggregator until its window closes.
 */
public record Bar(
        String symbol,
        Duration timeframe,
        Instant openTime,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        BigDecimal volume
) {

    public Bar {
        Objects.requireNonNull(symbol, "symbol is required");
        Objects.requireNonNull(timeframe, "timeframe is required");
        Objects.requireNonNull(openTime, "openTime is required");
        Objects.requireNonNull(open, "open is required");
        Objects.requireNonNull(high, "high is required");
        Objects.requireNonNull(low, "low is required");
        Objects.requireNonNull(close, "close is required");
        volume = volume == null ? BigDecimal.ZERO : volume;
        if (high.compareTo(open.max(close)) < 0) {
            throw new IllegalArgumentException("high must be >= max(open, close) for " + symbol + " at " + openTime);
        }
        if (low.compareTo(open.min(close)) > 0) {
            throw new IllegalArgumentException("low must be <= min(open, close) for " + symbol + " at " + openTime);
        }
        if (volume.signum() < 0) {
            throw new IllegalArgumentException("volume must be >= 0 for " + symbol + " at " + openTime);
        }
    }

    public Instant closeTime() {
        return openTime.plus(timeframe);
    }
}
