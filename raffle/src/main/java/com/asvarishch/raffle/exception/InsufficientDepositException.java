package com.asvarishch.raffle.exception;

import java.math.BigDecimal;
import java.util.Map;

public class InsufficientDepositException extends RaffleException {

    public InsufficientDepositException(BigDecimal amount, BigDecimal entranceFee) {
        super("Deposit " + amount.toPlainString() + " is below the entrance fee " + entranceFee.toPlainString(),
                "INSUFFICIENT_DEPOSIT",
                Map.of("amount", amount, "entranceFee", entranceFee));
    }
}
