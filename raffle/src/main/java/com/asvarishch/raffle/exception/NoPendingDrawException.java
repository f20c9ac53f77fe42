package com.asvarishch.raffle.exception;

import java.util.Map;

/** Fulfillment arrived while no draw is in flight. */
public class NoPendingDrawException extends RaffleException {

    public NoPendingDrawException(long requestId) {
        super("No draw is pending; rejecting fulfillment for requestId=" + requestId,
                "NO_PENDING_DRAW",
                Map.of("requestId", requestId));
    }
}
