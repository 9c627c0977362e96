package org.nowstart.traderbot.indicator;

import org.nowstart.traderbot.data.dto.Bar;

/**
 * Wilder ATR. The first value is the mean true range of the first {@code period} bars.
 */
public class AverageTrueRange implements Indicator {

    private final int period;
    private double previousClose = Double.NaN;
    private double trueRangeSum;
    private int count;
    private double atr = Double.NaN;

    public AverageTrueRange(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.period = period;
    }

    public static String key(int period) {
        return "atr_" + period;
    }

    @Override
    public String key() {
        return key(period);
    }

    @Override
    public double update(Bar bar) {
        double high = bar.high().doubleValue();
        double low = bar.low().doubleValue();
        double trueRange = high - low;
        if (!Double.isNaN(previousClose)) {
            double highPrevClose = Math.abs(high - previousClose);
            double lowPrevClose = Math.abs(low - previousClose);
            trueRange = Math.max(trueRange, Math.max(highPrevClose, lowPrevClose));
        }
        previousClose = bar.close().doubleValue();
        count++;

        if (count < period) {
            trueRangeSum += trueRange;
            return Double.NaN;
        }
        if (count == period) {
            atr = (trueRangeSum + trueRange) / period;
            return atr;
        }
        atr = ((atr * (period - 1)) + trueRange) / period;
        return atr;
    }
}
