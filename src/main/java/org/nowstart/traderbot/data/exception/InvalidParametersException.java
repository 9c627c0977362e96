package org.nowstart.traderbot.data.exception;

import java.util.List;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InvalidParametersException extends TradingApiException {

    private final List<String> violations;

    public InvalidParametersException(String strategy, List<String> violations) {
        super(
                HttpStatus.BAD_REQUEST,
                "invalid_parameters",
                "Invalid parameters for strategy " + strategy + ": " + String.join("; ", violations)
        );
        this.violations = List.copyOf(violations);
    }
}
