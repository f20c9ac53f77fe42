package com.asvarishch.raffle.gateway;

/**
 * Parameters of one randomness request.
 *
 * @param gasLane              key hash selecting the provider's price lane
 * @param subscriptionId       billing subscription of the requester
 * @param requestConfirmations confirmation depth the provider waits before answering
 * @param callbackGasLimit     resource budget for the callback
 * @param numWords             number of random values requested
 */
public record RandomnessRequest(
        String gasLane,
        long subscriptionId,
        int requestConfirmations,
        long callbackGasLimit,
        int numWords
) {
}
