package org.nowstart.traderbot.indicator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class IndicatorSeries {

    private final String key;
    private final List<Double> values = new ArrayList<>();

    public IndicatorSeries(String key) {
        this.key = key;
    }

    void append(double value) {
        values.add(value);
    }

    public String key() {
        return key;
    }

    public int size() {
        return values.size();
    }

    public double get(int index) {
        return values.get(index);
    }

    public double latest() {
        return values.isEmpty() ? Double.NaN : values.get(values.size() - 1);
    }

    public List<Double> values() {
        return Collections.unmodifiableList(values);
    }
}
