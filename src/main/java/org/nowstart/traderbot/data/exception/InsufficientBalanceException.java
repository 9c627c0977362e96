package org.nowstart.traderbot.data.exception;

import java.math.BigDecimal;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InsufficientBalanceException extends TradingApiException {

    private final BigDecimal balance;
    private final BigDecimal required;

    public InsufficientBalanceException(String symbol, BigDecimal balance, BigDecimal required) {
        super(
                HttpStatus.UNPROCESSABLE_ENTITY,
                "insufficient_balance",
                "Insufficient balance for " + symbol + ": balance=" + balance.toPlainString()
                        + ", required=" + required.toPlainString()
        );
        this.balance = balance;
        this.required = required;
    }
}
