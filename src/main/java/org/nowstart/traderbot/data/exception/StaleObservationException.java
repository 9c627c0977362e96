package org.nowstart.traderbot.data.exception;

import java.time.Instant;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class StaleObservationException extends TradingApiException {

    private final Instant observedAt;
    private final Instant openWindowStart;

    public StaleObservationException(String symbol, Instant observedAt, Instant openWindowStart) {
        super(
                HttpStatus.UNPROCESSABLE_ENTITY,
                "stale_observation",
                "Observation for " + symbol + " at " + observedAt + " is earlier than open window " + openWindowStart
        );
        this.observedAt = observedAt;
        this.openWindowStart = openWindowStart;
    }
}
