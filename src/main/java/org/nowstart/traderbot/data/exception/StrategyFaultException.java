package org.nowstart.traderbot.data.exception;

import org.springframework.http.HttpStatus;

public class StrategyFaultException extends TradingApiException {

    public StrategyFaultException(String instanceId, String message, Throwable cause) {
        super(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "strategy_fault",
                "Strategy instance " + instanceId + " faulted: " + message,
                cause
        );
    }
}
