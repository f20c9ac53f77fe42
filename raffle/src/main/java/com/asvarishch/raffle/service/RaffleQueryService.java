package com.asvarishch.raffle.service;

import com.asvarishch.raffle.config.RaffleProperties;
import com.asvarishch.raffle.dto.RaffleSnapshotDTO;
import com.asvarishch.raffle.enums.RaffleState;
import com.asvarishch.raffle.exception.PlayerIndexOutOfRangeException;
import com.asvarishch.raffle.model.Participant;
import com.asvarishch.raffle.model.Raffle;
import com.asvarishch.raffle.repository.RaffleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/** Read-only projections of the raffle. */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RaffleQueryService {

    private final RaffleRepository raffleRepository;
    private final RaffleProperties properties;

    public BigDecimal getEntranceFee() {
        return load().getEntranceFee();
    }

    /**
     * @throws PlayerIndexOutOfRangeException if {@code index} is negative or not below the player count
     */
    public String getPlayer(int index) {
        final Raffle raffle = load();
        final int players = raffle.getNumberOfPlayers();
        if (index < 0 || index >= players) {
            throw new PlayerIndexOutOfRangeException(index, players);
        }
        return raffle.getLedger().participantAt(index).getPlayer();
    }

    public String getRecentWinner() {
        return load().getRecentWinner();
    }

    public RaffleState getRaffleState() {
        return load().getState();
    }

    public int getNumberOfPlayers() {
        return load().getNumberOfPlayers();
    }

    public Instant getLatestTimestamp() {
        return load().getLastDrawTimestamp();
    }

    public Duration getInterval() {
        return load().getInterval();
    }

    public int getRequestConfirmations() {
        return properties.getVrf().getRequestConfirmations();
    }

    public int getNumWords() {
        return properties.getVrf().getNumWords();
    }

    public RaffleSnapshotDTO getSnapshot() {
        final Raffle raffle = load();
        return RaffleSnapshotDTO.builder()
                .name(raffle.getName())
                .state(raffle.getState())
                .entranceFee(raffle.getEntranceFee())
                .intervalSeconds(raffle.getInterval().toSeconds())
                .lastDrawTimestamp(raffle.getLastDrawTimestamp())
                .pendingRequestId(raffle.getPendingRequestId())
                .recentWinner(raffle.getRecentWinner())
                .roundNumber(raffle.getRoundNumber())
                .players(raffle.getLedger().view().stream().map(Participant::getPlayer).toList())
                .poolBalance(raffle.getPoolBalance())
                .build();
    }

    private Raffle load() {
        return raffleRepository.findById(Raffle.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Raffle not initialised: id=" + Raffle.SINGLETON_ID));
    }
}
