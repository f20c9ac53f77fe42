package com.asvarishch.raffle.service;

import com.asvarishch.raffle.enums.RaffleState;

import java.math.BigDecimal;

/**
 * Result of one upkeep evaluation, with each condition kept separately for diagnostics.
 */
public record UpkeepCheck(
        boolean isOpen,
        boolean timePassed,
        boolean hasPlayers,
        boolean hasBalance,
        RaffleState state,
        int numPlayers,
        BigDecimal balance
) {

    public boolean upkeepNeeded() {
        return isOpen && timePassed && hasPlayers && hasBalance;
    }
}
