package com.asvarishch.raffle.exception;

import java.util.Map;

public class UnknownRandomnessRequestException extends RaffleException {

    public UnknownRandomnessRequestException(long requestId) {
        super("nonexistent request: " + requestId, "UNKNOWN_REQUEST", Map.of("requestId", requestId));
    }
}
