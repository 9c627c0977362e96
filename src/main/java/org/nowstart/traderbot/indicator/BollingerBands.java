package org.nowstart.traderbot.indicator;

import java.math.BigDecimal;
import java.math.MathContext;
import org.nowstart.traderbot.data.dto.Bar;

/**
 * Bollinger band over a rolling window of closes using the sample standard deviation.
 */
public class BollingerBands implements Indicator {

    public enum Component {
        MIDDLE("bb_middle"),
        UPPER("bb_upper"),
        LOWER("bb_lower");

        private final String prefix;

        Component(String prefix) {
            this.prefix = prefix;
        }
    }

    private final int period;
    private final double multiplier;
    private final Component component;
    private final BigDecimal[] window;
    private BigDecimal sum = BigDecimal.ZERO;
    private BigDecimal sumOfSquares = BigDecimal.ZERO;
    private int count;
    private int head;

    public BollingerBands(int period, double multiplier, Component component) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2");
        }
        if (!Double.isFinite(multiplier) || multiplier < 0.0) {
            throw new IllegalArgumentException("multiplier must be finite and >= 0");
        }
        this.period = period;
        this.multiplier = multiplier;
        this.component = component;
        this.window = new BigDecimal[period];
    }

    public static String key(Component component, int period, double multiplier) {
        return component.prefix + "_" + period + "_" + BigDecimal.valueOf(multiplier).stripTrailingZeros().toPlainString();
    }

    @Override
    public String key() {
        return key(component, period, multiplier);
    }

    @Override
    public double update(Bar bar) {
        BigDecimal close = bar.close();
        if (count == period) {
            BigDecimal evicted = window[head];
            sum = sum.subtract(evicted);
            sumOfSquares = sumOfSquares.subtract(evicted.multiply(evicted));
        } else {
            count++;
        }
        window[head] = close;
        head = (head + 1) % period;
        sum = sum.add(close);
        sumOfSquares = sumOfSquares.add(close.multiply(close));

        if (count < period) {
            return Double.NaN;
        }

        BigDecimal n = BigDecimal.valueOf(period);
        BigDecimal mean = sum.divide(n, MathContext.DECIMAL64);
        if (component == Component.MIDDLE) {
            return mean.doubleValue();
        }

        BigDecimal variance = sumOfSquares
                .subtract(sum.multiply(sum).divide(n, MathContext.DECIMAL64))
                .divide(BigDecimal.valueOf(period - 1L), MathContext.DECIMAL64);
        double stdDev = Math.sqrt(Math.max(0.0, variance.doubleValue()));
        double offset = multiplier * stdDev;
        return component == Component.UPPER
                ? mean.doubleValue() + offset
                : mean.doubleValue() - offset;
    }
}
