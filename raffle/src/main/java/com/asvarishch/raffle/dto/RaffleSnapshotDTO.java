package com.asvarishch.raffle.dto;

import com.asvarishch.raffle.enums.RaffleState;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Builder
public record RaffleSnapshotDTO(
        String name,
        RaffleState state,
        BigDecimal entranceFee,
        long intervalSeconds,
        Instant lastDrawTimestamp,
        Long pendingRequestId,
        String recentWinner,
        long roundNumber,
        List<String> players,
        BigDecimal poolBalance
) {
}
