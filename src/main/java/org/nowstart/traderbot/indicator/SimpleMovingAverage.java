package org.nowstart.traderbot.indicator;

import java.math.BigDecimal;
import org.nowstart.traderbot.data.dto.Bar;

public class SimpleMovingAverage implements Indicator {

    private final int period;
    private final BigDecimal[] window;
    private BigDecimal sum = BigDecimal.ZERO;
    private int count;
    private int head;

    public SimpleMovingAverage(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.period = period;
        this.window = new BigDecimal[period];
    }

    public static String key(int period) {
        return "sma_" + period;
    }

    @Override
    public String key() {
        return key(period);
    }

    @Override
    public double update(Bar bar) {
        BigDecimal close = bar.close();
        if (count == period) {
            sum = sum.subtract(window[head]);
        } else {
            count++;
        }
        window[head] = close;
        head = (head + 1) % period;
        sum = sum.add(close);

        if (count < period) {
            return Double.NaN;
        }
        // exact running sum; only the final division is floating point
        return sum.doubleValue() / period;
    }
}
