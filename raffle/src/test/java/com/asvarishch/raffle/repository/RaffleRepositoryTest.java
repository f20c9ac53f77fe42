package com.asvarishch.raffle.repository;

import com.asvarishch.raffle.enums.RaffleState;
import com.asvarishch.raffle.model.Participant;
import com.asvarishch.raffle.model.Raffle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;


@DataJpaTest
class RaffleRepositoryTest {

    private static final Instant DEPLOYED_AT = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private TestEntityManager em;

    @Autowired
    private RaffleRepository raffleRepository;

    // ---------- helpers ----------

    private Raffle persistRaffle() {
        Raffle raffle = Raffle.builder()
                .raffleId(Raffle.SINGLETON_ID)
                .name("raffle")
                .entranceFee(new BigDecimal("0.01"))
                .interval(Duration.ofSeconds(300))
                .lastDrawTimestamp(DEPLOYED_AT)
                .build();
        em.persist(raffle);
        return raffle;
    }

    private static Participant entry(String player) {
        return new Participant(player, new BigDecimal("0.01"), DEPLOYED_AT);
    }

    // ---------- tests ----------

    @Test
    @DisplayName("Participants are stored and reloaded in entry order with the pool")
    void participantsKeepOrder() {
        Raffle raffle = persistRaffle();
        raffle.acceptEntry(entry("C"));
        raffle.acceptEntry(entry("A"));
        raffle.acceptEntry(entry("B"));
        em.flush();
        em.clear();

        Optional<Raffle> reloaded = raffleRepository.findById(Raffle.SINGLETON_ID);

        assertThat(reloaded).isPresent();
        assertThat(reloaded.get().getLedger().view()).extracting(Participant::getPlayer).containsExactly("C", "A", "B");
        assertThat(reloaded.get().getPoolBalance()).isEqualByComparingTo("0.03");
        assertThat(reloaded.get().getInterval()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    @DisplayName("findByIdForUpdate() returns the row for the locked section")
    void findByIdForUpdate_returnsRow() {
        persistRaffle();
        em.flush();
        em.clear();

        Optional<Raffle> locked = raffleRepository.findByIdForUpdate(Raffle.SINGLETON_ID);

        assertThat(locked).isPresent();
        assertThat(locked.get().getState()).isEqualTo(RaffleState.OPEN);
    }

    @Test
    @DisplayName("findByIdForUpdate() returns empty before deployment")
    void findByIdForUpdate_missing() {
        assertThat(raffleRepository.findByIdForUpdate(Raffle.SINGLETON_ID)).isEmpty();
    }

    @Test
    @DisplayName("A completed draw persists the reset: no participants, zero pool, winner and timestamp stored")
    void resetIsPersisted() {
        Raffle raffle = persistRaffle();
        raffle.acceptEntry(entry("A"));
        raffle.acceptEntry(entry("B"));
        em.flush();
        raffle.startDraw(1L);
        Instant drawnAt = DEPLOYED_AT.plus(10, ChronoUnit.MINUTES);
        raffle.completeDraw(1L, BigInteger.ONE, drawnAt);
        em.flush();
        em.clear();

        Raffle reloaded = raffleRepository.findById(Raffle.SINGLETON_ID).orElseThrow();

        assertThat(reloaded.getState()).isEqualTo(RaffleState.OPEN);
        assertThat(reloaded.getNumberOfPlayers()).isZero();
        assertThat(reloaded.getPoolBalance()).isEqualByComparingTo("0");
        assertThat(reloaded.getRecentWinner()).isEqualTo("B");
        assertThat(reloaded.getPendingRequestId()).isNull();
        assertThat(reloaded.getLastDrawTimestamp()).isEqualTo(drawnAt);
        assertThat(reloaded.getRoundNumber()).isEqualTo(1L);
    }
}
