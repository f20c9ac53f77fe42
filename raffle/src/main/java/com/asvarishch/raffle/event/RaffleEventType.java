package com.asvarishch.raffle.event;

public enum RaffleEventType {
    RAFFLE_ENTERED,
    RANDOMNESS_REQUESTED,
    WINNER_PICKED
}
