package org.nowstart.traderbot.indicator;

import org.nowstart.traderbot.data.dto.Bar;

public class ExponentialMovingAverage implements Indicator {

    private final int period;
    private final ExponentialSmoother smoother;

    public ExponentialMovingAverage(int period) {
        this.period = period;
        this.smoother = new ExponentialSmoother(period);
    }

    public static String key(int period) {
        return "ema_" + period;
    }

    @Override
    public String key() {
        return key(period);
    }

    @Override
    public double update(Bar bar) {
        return smoother.next(bar.close().doubleValue());
    }
}
