package com.asvarishch.raffle.payout;

import com.asvarishch.raffle.exception.PayoutFailedException;

import java.math.BigDecimal;

public interface PayoutTransfer {

    /**
     * Moves {@code amount} to {@code recipient}.
     *
     * @throws PayoutFailedException if the recipient cannot receive funds or the transfer is rejected
     */
    void transfer(String recipient, BigDecimal amount);
}
