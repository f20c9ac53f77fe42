package com.asvarishch.raffle.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;

@Getter
public class PayoutFailedException extends RaffleException {

    private final String recipient;
    private final BigDecimal amount;

    public PayoutFailedException(String recipient, BigDecimal amount, String reason) {
        super("Payout of " + amount.toPlainString() + " to " + recipient + " failed: " + reason,
                "PAYOUT_FAILED",
                Map.of("recipient", recipient, "amount", amount));
        this.recipient = recipient;
        this.amount = amount;
    }

    public PayoutFailedException(String recipient, BigDecimal amount, Throwable cause) {
        super("Payout of " + amount.toPlainString() + " to " + recipient + " failed: " + cause.getMessage(),
                "PAYOUT_FAILED",
                Map.of("recipient", recipient, "amount", amount),
                cause);
        this.recipient = recipient;
        this.amount = amount;
    }
}
