package com.asvarishch.raffle.exception;

import com.asvarishch.raffle.enums.RaffleState;

import java.util.Map;

public class RaffleNotOpenException extends RaffleException {

    public RaffleNotOpenException(RaffleState state) {
        super("Raffle is not open (state=" + state + ")", "RAFFLE_NOT_OPEN", Map.of("state", state));
    }
}
