package com.asvarishch.raffle.service;

import com.asvarishch.raffle.dto.EntryReceiptDTO;
import com.asvarishch.raffle.event.RaffleEvent;
import com.asvarishch.raffle.exception.RaffleException;
import com.asvarishch.raffle.model.Participant;
import com.asvarishch.raffle.model.Raffle;
import com.asvarishch.raffle.repository.RaffleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Records a player's paid entry into the current round.
 * <ol>
 *   <li>Validate input (player non-blank, amount present and not negative).</li>
 *   <li>Lock the raffle row.</li>
 *   <li>Apply the entry guard: raffle must be OPEN and the amount must cover the entrance fee.
 *       The whole amount goes to the pool; nothing above the fee is refunded.</li>
 *   <li>Publish {@code RAFFLE_ENTERED} (relayed after commit).</li>
 * </ol>
 * A rejected entry leaves the raffle untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RaffleEntryService {

    private final RaffleRepository raffleRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public EntryReceiptDTO enter(String player, BigDecimal amount) {
        validate(player, amount);

        final Raffle raffle = raffleRepository.findByIdForUpdate(Raffle.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Raffle not initialised: id=" + Raffle.SINGLETON_ID));

        final Instant now = clock.instant();
        final Participant participant = Participant.builder()
                .player(player)
                .amount(amount)
                .enteredAt(now)
                .build();

        try {
            raffle.acceptEntry(participant);
        } catch (RaffleException e) {
            log.info("Entry rejected: player={}, amount={}, state={}, fee={}, reason={}",
                    player, amount, raffle.getState(), raffle.getEntranceFee(), e.getErrorCode());
            throw e;
        }
        raffleRepository.save(raffle);

        log.info("Entry accepted: player={}, amount={}, players={}, pool={}, round={}",
                player, amount, raffle.getNumberOfPlayers(), raffle.getPoolBalance(), raffle.getRoundNumber());

        eventPublisher.publishEvent(RaffleEvent.entered(raffle.getRaffleId(), raffle.getRoundNumber(), player, amount, now));

        return EntryReceiptDTO.builder()
                .player(player)
                .amount(amount)
                .playerIndex(raffle.getNumberOfPlayers() - 1)
                .numberOfPlayers(raffle.getNumberOfPlayers())
                .poolBalance(raffle.getPoolBalance())
                .roundNumber(raffle.getRoundNumber())
                .build();
    }

    private static void validate(String player, BigDecimal amount) {
        if (player == null || player.isBlank()) {
            throw new IllegalArgumentException("player must not be blank");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }
    }
}
