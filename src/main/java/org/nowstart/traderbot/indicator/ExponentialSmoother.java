package org.nowstart.traderbot.indicator;

/**
 * EMA recurrence seeded by the simple mean of the first {@code period} inputs.
 */
class ExponentialSmoother {

    private final int period;
    private final double alpha;
    private double seedSum;
    private int seen;
    private double value = Double.NaN;

    ExponentialSmoother(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.period = period;
        this.alpha = 2.0 / (period + 1.0);
    }

    double next(double input) {
        seen++;
        if (seen < period) {
            seedSum += input;
            return Double.NaN;
        }
        if (seen == period) {
            seedSum += input;
            value = seedSum / period;
            return value;
        }
        value = (alpha * input) + ((1.0 - alpha) * value);
        return value;
    }
}
