package com.asvarishch.raffle.kafka;

import com.asvarishch.raffle.event.RaffleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RaffleEventProducer {

    private final KafkaTemplate<String, RaffleEvent> kafkaTemplate;

    /** Uses raffleId as key so all events of the raffle land on one partition, in order. */
    public void send(String topic, RaffleEvent event) {
        log.info("Publishing raffle event: type={}, round={}, player={}, amount={}, requestId={}",
                event.type(), event.roundNumber(), event.player(), event.amount(), event.requestId());
        kafkaTemplate.send(topic, String.valueOf(event.raffleId()), event);
    }
}
