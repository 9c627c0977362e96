package org.nowstart.traderbot.market;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Observation;
import org.nowstart.traderbot.data.exception.StaleObservationException;

/**
 * Buckets observations of one symbol into fixed windows aligned to the epoch. A bar is sealed by the first
 * observation of a later window, or by {@link #sealIfElapsed(Instant)} once wall-clock time passes its window.
 * Empty windows produce no bars. Not thread-safe; the owning pipeline serializes calls.
 */
public class OhlcAggregator {

    private final String symbol;
    private final Duration timeframe;
    private final long timeframeMillis;
    private MutableBar openBar;
    private Instant lastSealedWindow;

    public OhlcAggregator(String symbol, Duration timeframe) {
        this.symbol = Objects.requireNonNull(symbol, "symbol is required");
        this.timeframe = Objects.requireNonNull(timeframe, "timeframe is required");
        if (timeframe.toMillis() <= 0) {
            throw new IllegalArgumentException("timeframe must be at least 1ms");
        }
        this.timeframeMillis = timeframe.toMillis();
    }

    public Optional<Bar> ingest(Observation observation) {
        if (!symbol.equals(observation.symbol())) {
            throw new IllegalArgumentException(
                    "Aggregator for " + symbol + " cannot ingest observation for " + observation.symbol()
            );
        }
        Instant window = windowStart(observation.timestamp());

        if (openBar != null && window.isBefore(openBar.openTime())) {
            throw new StaleObservationException(symbol, observation.timestamp(), openBar.openTime());
        }
        if (lastSealedWindow != null && !window.isAfter(lastSealedWindow)) {
            throw new StaleObservationException(symbol, observation.timestamp(), lastSealedWindow.plus(timeframe));
        }

        if (openBar != null && window.equals(openBar.openTime())) {
            openBar.update(observation.price(), observation.quantity());
            return Optional.empty();
        }

        Optional<Bar> sealed = Optional.ofNullable(openBar).map(this::seal);
        openBar = new MutableBar(symbol, timeframe, window, observation.price(), observation.quantity());
        return sealed;
    }

    /**
     * Seals the open bar when {@code now} is at or past its close time.
     */
    public Optional<Bar> sealIfElapsed(Instant now) {
        if (openBar == null || now.isBefore(openBar.openTime().plus(timeframe))) {
            return Optional.empty();
        }
        Bar sealed = seal(openBar);
        openBar = null;
        return Optional.of(sealed);
    }

    public Optional<Bar> currentBar() {
        return Optional.ofNullable(openBar).map(MutableBar::toBar);
    }

    public Instant windowStart(Instant timestamp) {
        long epochMillis = timestamp.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(epochMillis, timeframeMillis) * timeframeMillis);
    }

    public String symbol() {
        return symbol;
    }

    public Duration timeframe() {
        return timeframe;
    }

    private Bar seal(MutableBar bar) {
        lastSealedWindow = bar.openTime();
        return bar.toBar();
    }
}
