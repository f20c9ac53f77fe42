package com.asvarishch.raffle.event;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Notification for off-chain observers. Fields not relevant to a given {@link RaffleEventType} are null.
 */
@Builder
public record RaffleEvent(
        RaffleEventType type,
        long raffleId,
        long roundNumber,
        String player,
        BigDecimal amount,
        Long requestId,
        Instant occurredAt
) {

    public static RaffleEvent entered(long raffleId, long roundNumber, String player, BigDecimal amount, Instant at) {
        return RaffleEvent.builder()
                .type(RaffleEventType.RAFFLE_ENTERED)
                .raffleId(raffleId)
                .roundNumber(roundNumber)
                .player(player)
                .amount(amount)
                .occurredAt(at)
                .build();
    }

    public static RaffleEvent randomnessRequested(long raffleId, long roundNumber, long requestId, Instant at) {
        return RaffleEvent.builder()
                .type(RaffleEventType.RANDOMNESS_REQUESTED)
                .raffleId(raffleId)
                .roundNumber(roundNumber)
                .requestId(requestId)
                .occurredAt(at)
                .build();
    }

    public static RaffleEvent winnerPicked(long raffleId, long roundNumber, long requestId,
                                           String winner, BigDecimal payout, Instant at) {
        return RaffleEvent.builder()
                .type(RaffleEventType.WINNER_PICKED)
                .raffleId(raffleId)
                .roundNumber(roundNumber)
                .requestId(requestId)
                .player(winner)
                .amount(payout)
                .occurredAt(at)
                .build();
    }
}
