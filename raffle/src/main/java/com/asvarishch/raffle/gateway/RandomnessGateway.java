package com.asvarishch.raffle.gateway;

/**
 * External source of verifiable randomness. Requests are answered asynchronously: the values arrive later
 * through the registered {@link RandomnessConsumer}, keyed by the id returned here. The gateway only
 * delivers fulfillments for ids it issued, each at most once.
 */
public interface RandomnessGateway {

    long requestRandomWords(RandomnessRequest request);
}
