package org.nowstart.traderbot.strategy.core;

/**
 * Line crossing checks between two consecutive bars. Any undefined (NaN) value means no crossing.
 */
public final class Crossover {

    private Crossover() {
    }

    public static boolean crossedAbove(double previousLine, double previousReference, double line, double reference) {
        if (anyNaN(previousLine, previousReference, line, reference)) {
            return false;
        }
        return previousLine <= previousReference && line > reference;
    }

    public static boolean crossedBelow(double previousLine, double previousReference, double line, double reference) {
        if (anyNaN(previousLine, previousReference, line, reference)) {
            return false;
        }
        return previousLine >= previousReference && line < reference;
    }

    private static boolean anyNaN(double... values) {
        for (double value : values) {
            if (Double.isNaN(value)) {
                return true;
            }
        }
        return false;
    }
}
