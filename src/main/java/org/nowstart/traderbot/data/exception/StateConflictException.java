package org.nowstart.traderbot.data.exception;

import org.springframework.http.HttpStatus;

public class StateConflictException extends TradingApiException {

    public StateConflictException(String message) {
        super(HttpStatus.CONFLICT, "state_conflict", message);
    }
}
