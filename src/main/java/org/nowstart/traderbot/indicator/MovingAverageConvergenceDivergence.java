package org.nowstart.traderbot.indicator;

import org.nowstart.traderbot.data.dto.Bar;

public class MovingAverageConvergenceDivergence implements Indicator {

    public enum Component {
        LINE("macd"),
        SIGNAL("macd_signal"),
        HISTOGRAM("macd_hist");

        private final String prefix;

        Component(String prefix) {
            this.prefix = prefix;
        }
    }

    private final int fastPeriod;
    private final int slowPeriod;
    private final int signalPeriod;
    private final Component component;
    private final ExponentialSmoother fast;
    private final ExponentialSmoother slow;
    private final ExponentialSmoother signal;

    public MovingAverageConvergenceDivergence(int fastPeriod, int slowPeriod, int signalPeriod, Component component) {
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("fastPeriod must be < slowPeriod");
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.signalPeriod = signalPeriod;
        this.component = component;
        this.fast = new ExponentialSmoother(fastPeriod);
        this.slow = new ExponentialSmoother(slowPeriod);
        this.signal = new ExponentialSmoother(signalPeriod);
    }

    public static String key(Component component, int fastPeriod, int slowPeriod, int signalPeriod) {
        return component.prefix + "_" + fastPeriod + "_" + slowPeriod + "_" + signalPeriod;
    }

    @Override
    public String key() {
        return key(component, fastPeriod, slowPeriod, signalPeriod);
    }

    @Override
    public double update(Bar bar) {
        double close = bar.close().doubleValue();
        double fastValue = fast.next(close);
        double slowValue = slow.next(close);
        if (Double.isNaN(fastValue) || Double.isNaN(slowValue)) {
            return Double.NaN;
        }

        double line = fastValue - slowValue;
        double signalValue = signal.next(line);
        return switch (component) {
            case LINE -> line;
            case SIGNAL -> signalValue;
            case HISTOGRAM -> Double.isNaN(signalValue) ? Double.NaN : line - signalValue;
        };
    }
}
