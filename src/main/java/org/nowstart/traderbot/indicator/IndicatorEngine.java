package org.nowstart.traderbot.indicator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.Bar;

/**
 * Per-session indicator state. Every registered series receives exactly one value per sealed bar, so
 * {@code series(key).size() == sealedBarCount()} holds at all times.
 */
@Slf4j
public class IndicatorEngine {

    private final Map<String, Indicator> indicators = new LinkedHashMap<>();
    private final Map<String, IndicatorSeries> series = new LinkedHashMap<>();
    private int sealedBarCount;

    public void registerAll(List<? extends Indicator> toRegister) {
        toRegister.forEach(this::register);
    }

    public void register(Indicator indicator) {
        if (sealedBarCount > 0) {
            throw new IllegalStateException(
                    "Indicators must be registered before the first bar; key=" + indicator.key()
                            + ", sealedBars=" + sealedBarCount
            );
        }
        if (indicators.putIfAbsent(indicator.key(), indicator) == null) {
            series.put(indicator.key(), new IndicatorSeries(indicator.key()));
            log.debug("event=indicator_registered key={}", indicator.key());
        }
    }

    public Map<String, Double> onBar(Bar bar) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, Indicator> entry : indicators.entrySet()) {
            double value = entry.getValue().update(bar);
            series.get(entry.getKey()).append(value);
            values.put(entry.getKey(), value);
        }
        sealedBarCount++;
        return Collections.unmodifiableMap(values);
    }

    public IndicatorSeries series(String key) {
        IndicatorSeries found = series.get(key);
        if (found == null) {
            throw new IllegalArgumentException("No indicator registered for key=" + key);
        }
        return found;
    }

    public Map<String, Double> latest() {
        Map<String, Double> values = new LinkedHashMap<>();
        series.forEach((key, s) -> values.put(key, s.latest()));
        return values;
    }

    public List<String> keys() {
        return List.copyOf(indicators.keySet());
    }

    public int sealedBarCount() {
        return sealedBarCount;
    }
}
