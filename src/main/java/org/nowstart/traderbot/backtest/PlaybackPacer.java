package org.nowstart.traderbot.backtest;

import java.time.Duration;
import org.nowstart.traderbot.data.type.PlaybackMode;

/**
 * Delay between replay steps: none when running as fast as possible, otherwise {@code timeframe / rate}.
 */
public class PlaybackPacer {

    private final PlaybackMode mode;
    private final double rate;
    private final Duration delay;

    public PlaybackPacer(PlaybackMode mode, Duration timeframe, double rate) {
        if (!(rate > 0.0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("playback rate must be finite and > 0");
        }
        this.mode = mode;
        this.rate = rate;
        this.delay = mode == PlaybackMode.WALL_CLOCK
                ? Duration.ofNanos((long) (timeframe.toNanos() / rate))
                : Duration.ZERO;
    }

    public Duration delay() {
        return delay;
    }

    public PlaybackMode mode() {
        return mode;
    }

    public double rate() {
        return rate;
    }
}
