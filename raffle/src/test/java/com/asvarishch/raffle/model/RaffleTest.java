package com.asvarishch.raffle.model;

import com.asvarishch.raffle.enums.RaffleState;
import com.asvarishch.raffle.exception.InsufficientDepositException;
import com.asvarishch.raffle.exception.NoPendingDrawException;
import com.asvarishch.raffle.exception.RaffleNotOpenException;
import com.asvarishch.raffle.exception.UnknownRandomnessRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RaffleTest {

    private static final BigDecimal FEE = new BigDecimal("0.01");
    private static final Instant DEPLOYED_AT = Instant.parse("2024-01-01T00:00:00Z");

    private Raffle raffle;

    @BeforeEach
    void setUp() {
        raffle = Raffle.builder()
                .raffleId(Raffle.SINGLETON_ID)
                .name("test")
                .entranceFee(FEE)
                .interval(Duration.ofSeconds(300))
                .lastDrawTimestamp(DEPLOYED_AT)
                .build();
    }

    private static Participant entry(String player, String amount) {
        return Participant.builder()
                .player(player)
                .amount(new BigDecimal(amount))
                .enteredAt(DEPLOYED_AT)
                .build();
    }

    @Test
    @DisplayName("New raffle starts OPEN, empty, zero pool, no pending request")
    void initialState() {
        assertThat(raffle.getState()).isEqualTo(RaffleState.OPEN);
        assertThat(raffle.getNumberOfPlayers()).isZero();
        assertThat(raffle.getPoolBalance()).isEqualByComparingTo("0");
        assertThat(raffle.getPendingRequestId()).isNull();
        assertThat(raffle.getRecentWinner()).isNull();
    }

    @Nested
    @DisplayName("acceptEntry")
    class AcceptEntry {

        @Test
        @DisplayName("Deposit equal to the fee adds one player and the amount to the pool")
        void exactFee() {
            raffle.acceptEntry(entry("0xA", "0.01"));

            assertThat(raffle.getNumberOfPlayers()).isEqualTo(1);
            assertThat(raffle.getPoolBalance()).isEqualByComparingTo("0.01");
        }

        @Test
        @DisplayName("Deposit above the fee is kept whole")
        void excessKept() {
            raffle.acceptEntry(entry("0xA", "0.05"));

            assertThat(raffle.getPoolBalance()).isEqualByComparingTo("0.05");
        }

        @Test
        @DisplayName("Same player may enter more than once; order is entry order")
        void orderPreserved() {
            raffle.acceptEntry(entry("0xA", "0.01"));
            raffle.acceptEntry(entry("0xB", "0.01"));
            raffle.acceptEntry(entry("0xA", "0.01"));

            assertThat(raffle.getLedger().view()).extracting(Participant::getPlayer)
                    .containsExactly("0xA", "0xB", "0xA");
        }

        @Test
        @DisplayName("Deposit below the fee -> InsufficientDeposit, nothing recorded")
        void belowFee() {
            assertThatThrownBy(() -> raffle.acceptEntry(entry("0xA", "0.009")))
                    .isInstanceOf(InsufficientDepositException.class);

            assertThat(raffle.getNumberOfPlayers()).isZero();
            assertThat(raffle.getPoolBalance()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Entry while CALCULATING -> RaffleNotOpen, nothing recorded")
        void whileCalculating() {
            raffle.acceptEntry(entry("0xA", "0.01"));
            raffle.startDraw(1L);

            assertThatThrownBy(() -> raffle.acceptEntry(entry("0xB", "0.01")))
                    .isInstanceOf(RaffleNotOpenException.class);

            assertThat(raffle.getNumberOfPlayers()).isEqualTo(1);
            assertThat(raffle.getPoolBalance()).isEqualByComparingTo("0.01");
        }
    }

    @Nested
    @DisplayName("draw transitions")
    class Transitions {

        @Test
        @DisplayName("startDraw moves to CALCULATING and keeps participants")
        void startDraw() {
            raffle.acceptEntry(entry("0xA", "0.01"));

            raffle.startDraw(42L);

            assertThat(raffle.getState()).isEqualTo(RaffleState.CALCULATING);
            assertThat(raffle.getPendingRequestId()).isEqualTo(42L);
            assertThat(raffle.getNumberOfPlayers()).isEqualTo(1);
        }

        @Test
        @DisplayName("Second startDraw while CALCULATING is rejected")
        void secondStartDraw() {
            raffle.acceptEntry(entry("0xA", "0.01"));
            raffle.startDraw(1L);

            assertThatThrownBy(() -> raffle.startDraw(2L)).isInstanceOf(RaffleNotOpenException.class);
            assertThat(raffle.getPendingRequestId()).isEqualTo(1L);
        }

        @Test
        @DisplayName("completeDraw picks randomWord mod N, resets the round and reports the pool")
        void completeDraw() {
            raffle.acceptEntry(entry("A", "0.01"));
            raffle.acceptEntry(entry("B", "0.01"));
            raffle.acceptEntry(entry("C", "0.01"));
            raffle.acceptEntry(entry("D", "0.01"));
            raffle.startDraw(1L);
            Instant now = DEPLOYED_AT.plusSeconds(301);

            Raffle.DrawOutcome outcome = raffle.completeDraw(1L, BigInteger.valueOf(7), now);

            assertThat(outcome.winnerIndex()).isEqualTo(3);
            assertThat(outcome.winner()).isEqualTo("D");
            assertThat(outcome.payout()).isEqualByComparingTo("0.04");
            assertThat(outcome.roundNumber()).isZero();
            assertThat(raffle.getRecentWinner()).isEqualTo("D");
            assertThat(raffle.getState()).isEqualTo(RaffleState.OPEN);
            assertThat(raffle.getPendingRequestId()).isNull();
            assertThat(raffle.getNumberOfPlayers()).isZero();
            assertThat(raffle.getPoolBalance()).isEqualByComparingTo("0");
            assertThat(raffle.getLastDrawTimestamp()).isEqualTo(now);
            assertThat(raffle.getRoundNumber()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Words larger than a long still select by modulo")
        void hugeWord() {
            raffle.acceptEntry(entry("A", "0.01"));
            raffle.acceptEntry(entry("B", "0.01"));
            raffle.acceptEntry(entry("C", "0.01"));
            raffle.startDraw(1L);
            BigInteger word = BigInteger.TWO.pow(255).add(BigInteger.ONE); // 2^255 + 1; 2^255 mod 3 == 2

            Raffle.DrawOutcome outcome = raffle.completeDraw(1L, word, DEPLOYED_AT);

            assertThat(outcome.winnerIndex()).isZero();
            assertThat(outcome.winner()).isEqualTo("A");
        }

        @Test
        @DisplayName("completeDraw while OPEN -> NoPendingDraw, nothing changes")
        void completeWhileOpen() {
            raffle.acceptEntry(entry("A", "0.01"));

            assertThatThrownBy(() -> raffle.completeDraw(1L, BigInteger.ONE, DEPLOYED_AT))
                    .isInstanceOf(NoPendingDrawException.class);

            assertThat(raffle.getNumberOfPlayers()).isEqualTo(1);
            assertThat(raffle.getRecentWinner()).isNull();
        }

        @Test
        @DisplayName("completeDraw with another request id -> UnknownRandomnessRequest, nothing changes")
        void completeWrongId() {
            raffle.acceptEntry(entry("A", "0.01"));
            raffle.startDraw(5L);

            assertThatThrownBy(() -> raffle.completeDraw(6L, BigInteger.ONE, DEPLOYED_AT))
                    .isInstanceOf(UnknownRandomnessRequestException.class);

            assertThat(raffle.getState()).isEqualTo(RaffleState.CALCULATING);
            assertThat(raffle.getPendingRequestId()).isEqualTo(5L);
            assertThat(raffle.getNumberOfPlayers()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("restore() puts back every round field captured by checkpoint()")
    void checkpointRestore() {
        raffle.acceptEntry(entry("previous", "0.01"));
        raffle.startDraw(8L);
        raffle.completeDraw(8L, BigInteger.ZERO, DEPLOYED_AT);
        raffle.acceptEntry(entry("A", "0.01"));
        raffle.acceptEntry(entry("B", "0.02"));
        raffle.startDraw(9L);
        Raffle.RoundCheckpoint checkpoint = raffle.checkpoint();

        raffle.completeDraw(9L, BigInteger.ONE, DEPLOYED_AT.plusSeconds(1000));
        raffle.restore(checkpoint);

        assertThat(raffle.getState()).isEqualTo(RaffleState.CALCULATING);
        assertThat(raffle.getPendingRequestId()).isEqualTo(9L);
        assertThat(raffle.getRecentWinner()).isEqualTo("previous");
        assertThat(raffle.getLastDrawTimestamp()).isEqualTo(DEPLOYED_AT);
        assertThat(raffle.getRoundNumber()).isEqualTo(1L);
        assertThat(raffle.getLedger().view()).extracting(Participant::getPlayer).containsExactly("A", "B");
        assertThat(raffle.getPoolBalance()).isEqualByComparingTo("0.03");
    }

    @Nested
    @DisplayName("encapsulation")
    class Encapsulation {

        @Test
        @DisplayName("Participant list handed out is read-only; players and pool stay in step")
        void participantsReadOnly() {
            raffle.acceptEntry(entry("A", "0.01"));

            assertThatThrownBy(() -> raffle.getLedger().getParticipants().add(entry("X", "0")))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> raffle.getLedger().view().clear())
                    .isInstanceOf(UnsupportedOperationException.class);

            assertThat(raffle.getNumberOfPlayers()).isEqualTo(1);
            assertThat(raffle.getPoolBalance()).isEqualByComparingTo("0.01");
        }

        @Test
        @DisplayName("No public setters: state, fee, interval and ledger change only through transitions")
        void noPublicSetters() {
            assertThat(Arrays.stream(Raffle.class.getMethods()).map(Method::getName))
                    .noneMatch(name -> name.startsWith("set"));
            assertThat(Arrays.stream(EntryLedger.class.getMethods()).map(Method::getName))
                    .doesNotContain("add", "clear", "replaceWith")
                    .noneMatch(name -> name.startsWith("set"));
        }
    }
}
