package com.asvarishch.raffle.gateway;

import java.math.BigInteger;
import java.util.List;

/**
 * Callback channel a {@link RandomnessGateway} delivers fulfilled values into.
 */
public interface RandomnessConsumer {

    void fulfillRandomWords(long requestId, List<BigInteger> randomWords);
}
