package com.asvarishch.raffle.dto;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record EntryReceiptDTO(
        String player,
        BigDecimal amount,
        int playerIndex,
        int numberOfPlayers,
        BigDecimal poolBalance,
        long roundNumber
) {
}
