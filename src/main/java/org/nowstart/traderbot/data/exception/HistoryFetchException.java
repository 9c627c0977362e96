package org.nowstart.traderbot.data.exception;

import org.springframework.http.HttpStatus;

public class HistoryFetchException extends TradingApiException {

    public HistoryFetchException(String message) {
        super(HttpStatus.BAD_GATEWAY, "history_fetch_error", message);
    }

    public HistoryFetchException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "history_fetch_error", message, cause);
    }
}
