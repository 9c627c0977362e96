package org.nowstart.traderbot.indicator;

import java.util.ArrayDeque;
import java.util.Deque;
import org.nowstart.traderbot.data.dto.Bar;

/**
 * Stochastic %K over rolling highest high / lowest low, and %D as the simple mean of the last
 * {@code dPeriod} defined %K values. Rolling extremes use monotonic deques.
 */
public class StochasticOscillator implements Indicator {

    public enum Component {
        K("stoch_k"),
        D("stoch_d");

        private final String prefix;

        Component(String prefix) {
            this.prefix = prefix;
        }
    }

    private final int kPeriod;
    private final int dPeriod;
    private final Component component;
    private final Deque<double[]> highs = new ArrayDeque<>();
    private final Deque<double[]> lows = new ArrayDeque<>();
    private final double[] kWindow;
    private double kSum;
    private int kCount;
    private int kHead;
    private long index;

    public StochasticOscillator(int kPeriod, int dPeriod, Component component) {
        if (kPeriod <= 0 || dPeriod <= 0) {
            throw new IllegalArgumentException("kPeriod and dPeriod must be > 0");
        }
        this.kPeriod = kPeriod;
        this.dPeriod = dPeriod;
        this.component = component;
        this.kWindow = new double[dPeriod];
    }

    public static String key(Component component, int kPeriod, int dPeriod) {
        return component.prefix + "_" + kPeriod + "_" + dPeriod;
    }

    @Override
    public String key() {
        return key(component, kPeriod, dPeriod);
    }

    @Override
    public double update(Bar bar) {
        double high = bar.high().doubleValue();
        double low = bar.low().doubleValue();
        double close = bar.close().doubleValue();

        while (!highs.isEmpty() && highs.peekLast()[1] <= high) {
            highs.pollLast();
        }
        highs.addLast(new double[] {index, high});
        while (!lows.isEmpty() && lows.peekLast()[1] >= low) {
            lows.pollLast();
        }
        lows.addLast(new double[] {index, low});

        long oldest = index - kPeriod + 1;
        while (highs.peekFirst()[0] < oldest) {
            highs.pollFirst();
        }
        while (lows.peekFirst()[0] < oldest) {
            lows.pollFirst();
        }
        index++;

        if (index < kPeriod) {
            return Double.NaN;
        }

        double highest = highs.peekFirst()[1];
        double lowest = lows.peekFirst()[1];
        double range = highest - lowest;
        double k = range > 0.0 ? 100.0 * (close - lowest) / range : Double.NaN;
        if (component == Component.K) {
            return k;
        }
        return nextD(k);
    }

    private double nextD(double k) {
        if (Double.isNaN(k)) {
            // an undefined %K restarts the %D window
            kSum = 0.0;
            kCount = 0;
            kHead = 0;
            return Double.NaN;
        }
        if (kCount == dPeriod) {
            kSum -= kWindow[kHead];
        } else {
            kCount++;
        }
        kWindow[kHead] = k;
        kHead = (kHead + 1) % dPeriod;
        kSum += k;
        return kCount < dPeriod ? Double.NaN : kSum / dPeriod;
    }
}
