package org.nowstart.traderbot.support;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.traderbot.data.dto.Bar;

public final class TestBars {

    public static final String SYMBOL = "BTCUSDT";
    public static final Duration TIMEFRAME = Duration.ofMinutes(1);
    public static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private TestBars() {
    }

    public static Instant openTime(int index) {
        return T0.plus(TIMEFRAME.multipliedBy(index));
    }

    public static Bar bar(int index, String close) {
        BigDecimal price = new BigDecimal(close);
        return new Bar(SYMBOL, TIMEFRAME, openTime(index), price, price, price, price, BigDecimal.ONE);
    }

    public static Bar ohlc(int index, String open, String high, String low, String close) {
        return new Bar(
                SYMBOL,
                TIMEFRAME,
                openTime(index),
                new BigDecimal(open),
                new BigDecimal(high),
                new BigDecimal(low),
                new BigDecimal(close),
                BigDecimal.ONE
        );
    }

    public static List<Bar> closes(String... closes) {
        List<Bar> bars = new ArrayList<>();
        for (int index = 0; index < closes.length; index++) {
            bars.add(bar(index, closes[index]));
        }
        return bars;
    }
}
