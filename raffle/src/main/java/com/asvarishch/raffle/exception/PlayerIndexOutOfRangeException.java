package com.asvarishch.raffle.exception;

import java.util.Map;

public class PlayerIndexOutOfRangeException extends RaffleException {

    public PlayerIndexOutOfRangeException(int index, int numPlayers) {
        super("Player index " + index + " out of range (players=" + numPlayers + ")",
                "PLAYER_INDEX_OUT_OF_RANGE",
                Map.of("index", index, "numPlayers", numPlayers));
    }
}
