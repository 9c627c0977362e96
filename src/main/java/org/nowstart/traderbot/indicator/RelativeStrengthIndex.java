package org.nowstart.traderbot.indicator;

import org.nowstart.traderbot.data.dto.Bar;

/**
 * Wilder RSI. The first average gain/loss is the simple mean of the first {@code period} close-to-close
 * changes; later averages use {@code avg = (prev * (period - 1) + current) / period}.
 */
public class RelativeStrengthIndex implements Indicator {

    private final int period;
    private double previousClose = Double.NaN;
    private double gainSum;
    private double lossSum;
    private int changes;
    private double avgGain = Double.NaN;
    private double avgLoss = Double.NaN;

    public RelativeStrengthIndex(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.period = period;
    }

    public static String key(int period) {
        return "rsi_" + period;
    }

    @Override
    public String key() {
        return key(period);
    }

    @Override
    public double update(Bar bar) {
        double close = bar.close().doubleValue();
        if (Double.isNaN(previousClose)) {
            previousClose = close;
            return Double.NaN;
        }

        double change = close - previousClose;
        previousClose = close;
        double gain = Math.max(change, 0.0);
        double loss = Math.max(-change, 0.0);
        changes++;

        if (changes < period) {
            gainSum += gain;
            lossSum += loss;
            return Double.NaN;
        }
        if (changes == period) {
            avgGain = (gainSum + gain) / period;
            avgLoss = (lossSum + loss) / period;
        } else {
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
        }
        return rsi(avgGain, avgLoss);
    }

    static double rsi(double avgGain, double avgLoss) {
        if (avgLoss <= 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        double value = 100.0 - (100.0 / (1.0 + rs));
        return Math.min(100.0, Math.max(0.0, value));
    }
}
