package com.asvarishch.raffle.gateway;

import com.asvarishch.raffle.exception.UnknownRandomnessRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process randomness provider. Requests stay pending until an operator (or a test) calls
 * {@link #fulfill(long)}; there is no timeout. Ids are issued from 1 upwards. A request made inside a
 * transaction is dropped again if that transaction rolls back. Fulfillments go to the single
 * {@link RandomnessConsumer} bean of the application.
 */
@Slf4j
@Component
public class LocalVrfCoordinator implements RandomnessGateway {

    private static final int WORD_BITS = 256;

    private final SecureRandom random = new SecureRandom();
    private final AtomicLong nextRequestId = new AtomicLong(1L);
    private final Map<Long, RandomnessRequest> pending = new ConcurrentHashMap<>();
    private final ObjectProvider<RandomnessConsumer> consumerProvider;

    public LocalVrfCoordinator(ObjectProvider<RandomnessConsumer> consumerProvider) {
        this.consumerProvider = consumerProvider;
    }

    @Override
    public long requestRandomWords(RandomnessRequest request) {
        if (request.numWords() <= 0) {
            throw new IllegalArgumentException("numWords must be positive");
        }
        final long requestId = nextRequestId.getAndIncrement();
        pending.put(requestId, request);
        discardOnRollback(requestId);
        log.info("[VRF] Request issued: requestId={}, gasLane={}, subId={}, confirmations={}, gasLimit={}, words={}",
                requestId, request.gasLane(), request.subscriptionId(), request.requestConfirmations(),
                request.callbackGasLimit(), request.numWords());
        return requestId;
    }

    /** Fulfills with fresh random 256-bit words. */
    public void fulfill(long requestId) {
        final RandomnessRequest request = requirePending(requestId);
        final List<BigInteger> words = new ArrayList<>(request.numWords());
        for (int i = 0; i < request.numWords(); i++) {
            words.add(new BigInteger(WORD_BITS, random));
        }
        deliver(requestId, words);
    }

    /** Fulfills with caller supplied words. */
    public void fulfill(long requestId, List<BigInteger> words) {
        requirePending(requestId);
        if (words == null || words.isEmpty()) {
            throw new IllegalArgumentException("words must not be empty");
        }
        deliver(requestId, List.copyOf(words));
    }

    public boolean isPending(long requestId) {
        return pending.containsKey(requestId);
    }

    private RandomnessRequest requirePending(long requestId) {
        final RandomnessRequest req = pending.get(requestId);
        if (req == null) {
            throw new UnknownRandomnessRequestException(requestId);
        }
        return req;
    }

    // A request issued inside a transaction that rolls back is never referenced by a raffle row.
    private void discardOnRollback(long requestId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK && pending.remove(requestId) != null) {
                    log.info("[VRF] Request discarded after rollback: requestId={}", requestId);
                }
            }
        });
    }

    // The request stays pending if the consumer throws, so the callback can be delivered again.
    private void deliver(long requestId, List<BigInteger> words) {
        log.info("[VRF] Fulfilling requestId={} with {} word(s)", requestId, words.size());
        consumerProvider.getObject().fulfillRandomWords(requestId, words);
        pending.remove(requestId);
    }
}
