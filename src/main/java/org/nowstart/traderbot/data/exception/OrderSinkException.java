package org.nowstart.traderbot.data.exception;

import org.springframework.http.HttpStatus;

public class OrderSinkException extends TradingApiException {

    public OrderSinkException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "order_sink_error", message, cause);
    }
}
