package com.asvarishch.raffle.kafka;

import com.asvarishch.raffle.event.RaffleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards raffle events to Kafka once the transaction that raised them has committed.
 * Events of rolled-back operations are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RaffleEventRelay {

    private final RaffleEventProducer producer;

    @Value("${topic.name}")
    private String topic;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCommitted(RaffleEvent event) {
        try {
            producer.send(topic, event);
        } catch (RuntimeException e) {
            // The raffle state is already committed; a lost notification must not surface as a failed operation.
            log.error("Failed to relay raffle event type={}, round={}: {}", event.type(), event.roundNumber(), e.getMessage(), e);
        }
    }
}
