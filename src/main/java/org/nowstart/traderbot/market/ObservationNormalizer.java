package org.nowstart.traderbot.market;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.Observation;
import org.springframework.stereotype.Component;

/**
 * Turns raw feed events into canonical observations: upper-case symbols without separators
 * ({@code btc/usdt} becomes {@code BTCUSDT}), positive prices and non-negative quantities.
 */
@Slf4j
@Component
public class ObservationNormalizer {

    public Optional<Observation> normalize(Observation raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw.symbol() == null || raw.symbol().isBlank()) {
            log.warn("event=observation_dropped reason=missing_symbol observation={}", raw);
            return Optional.empty();
        }
        if (raw.timestamp() == null) {
            log.warn("event=observation_dropped reason=missing_timestamp symbol={}", raw.symbol());
            return Optional.empty();
        }
        if (raw.price() == null || raw.price().signum() <= 0) {
            log.warn("event=observation_dropped reason=invalid_price symbol={} price={}", raw.symbol(), raw.price());
            return Optional.empty();
        }
        BigDecimal quantity = raw.quantity() == null ? BigDecimal.ZERO : raw.quantity();
        if (quantity.signum() < 0) {
            log.warn("event=observation_dropped reason=negative_quantity symbol={} quantity={}", raw.symbol(), quantity);
            return Optional.empty();
        }
        return Optional.of(new Observation(normalizeSymbol(raw.symbol()), raw.price(), quantity, raw.timestamp()));
    }

    public String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        return symbol.trim()
                .replace("/", "")
                .replace("-", "")
                .replace("_", "")
                .toUpperCase(Locale.ROOT);
    }
}
