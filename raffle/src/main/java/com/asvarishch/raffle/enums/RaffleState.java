package com.asvarishch.raffle.enums;

/**
 * Lifecycle of the single raffle round. There is no terminal state: the round
 * cycles OPEN -> CALCULATING -> OPEN for as long as the raffle exists.
 */
public enum RaffleState {
    /** Accepting entries; eligible for a draw trigger. */
    OPEN,
    /** Draw requested, waiting for the randomness callback. */
    CALCULATING
}
