package com.asvarishch.raffle.service;

import com.asvarishch.raffle.enums.RaffleState;
import com.asvarishch.raffle.model.Raffle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether a draw may start. Side-effect free; all four conditions must hold:
 * <ol>
 *   <li>the raffle is OPEN;</li>
 *   <li>strictly more than {@code interval} has elapsed since the last draw;</li>
 *   <li>at least one player entered;</li>
 *   <li>the pool balance is positive.</li>
 * </ol>
 */
@Component
public class UpkeepEvaluator {

    public UpkeepCheck evaluate(Raffle raffle, Instant now) {
        Objects.requireNonNull(raffle, "raffle must not be null");
        Objects.requireNonNull(now, "now must not be null");

        final boolean isOpen = raffle.getState() == RaffleState.OPEN;
        final Duration elapsed = Duration.between(raffle.getLastDrawTimestamp(), now);
        final boolean timePassed = elapsed.compareTo(raffle.getInterval()) > 0;
        final int numPlayers = raffle.getNumberOfPlayers();
        final boolean hasPlayers = numPlayers > 0;
        final boolean hasBalance = raffle.getPoolBalance().signum() > 0;

        return new UpkeepCheck(isOpen, timePassed, hasPlayers, hasBalance,
                raffle.getState(), numPlayers, raffle.getPoolBalance());
    }
}
