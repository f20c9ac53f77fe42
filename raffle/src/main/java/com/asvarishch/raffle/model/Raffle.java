package com.asvarishch.raffle.model;

import com.asvarishch.raffle.enums.RaffleState;
import com.asvarishch.raffle.exception.InsufficientDepositException;
import com.asvarishch.raffle.exception.NoPendingDrawException;
import com.asvarishch.raffle.exception.RaffleNotOpenException;
import com.asvarishch.raffle.exception.UnknownRandomnessRequestException;
import com.asvarishch.raffle.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The raffle round. Exactly one row exists ({@link #SINGLETON_ID}); it is created once and
 * reset in place after every draw, never deleted.
 * <p>
 * All mutations go through the guarded transition methods below:
 * <ul>
 *   <li>{@link #acceptEntry(Participant)}: OPEN only, amount must cover the entrance fee.</li>
 *   <li>{@link #startDraw(long)}: OPEN -> CALCULATING, remembers the pending request.</li>
 *   <li>{@link #completeDraw(long, BigInteger, Instant)}: CALCULATING -> OPEN for the pending request only.</li>
 * </ul>
 * There are no setters; the builder fixes fee and interval at creation.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@ToString(exclude = "ledger")
@EqualsAndHashCode(of = "raffleId", callSuper = false)
@Entity
@Table(name = "raffles")
public class Raffle extends AuditableEntity {

    public static final long SINGLETON_ID = 1L;

    @Id
    @Column(name = "raffle_id", nullable = false)
    private Long raffleId;

    @Column(name = "name", length = 120, nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 16, nullable = false)
    @Builder.Default
    private RaffleState state = RaffleState.OPEN;

    @Column(name = "entrance_fee", precision = 38, scale = 18, nullable = false, updatable = false)
    private BigDecimal entranceFee;

    @Column(name = "draw_interval", nullable = false, updatable = false)
    private Duration interval;

    @Column(name = "last_draw_timestamp", nullable = false)
    private Instant lastDrawTimestamp;

    /** Present only while CALCULATING. */
    @Column(name = "pending_request_id")
    private Long pendingRequestId;

    /** Overwritten on every draw, never cleared. */
    @Column(name = "recent_winner", length = 128)
    private String recentWinner;

    /** Increments each time the round is reset after a payout. */
    @Column(name = "round_number", nullable = false)
    private long roundNumber;

    @Embedded
    @Builder.Default
    private EntryLedger ledger = new EntryLedger();

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public boolean isOpen() {
        return state == RaffleState.OPEN;
    }

    public int getNumberOfPlayers() {
        return ledger.size();
    }

    public BigDecimal getPoolBalance() {
        return ledger.getPoolBalance();
    }

    /**
     * Appends the participant and adds its whole amount to the pool.
     *
     * @throws RaffleNotOpenException       if a draw is in flight
     * @throws InsufficientDepositException if the amount is below the entrance fee
     */
    public void acceptEntry(Participant participant) {
        Objects.requireNonNull(participant, "participant must not be null");
        if (state != RaffleState.OPEN) {
            throw new RaffleNotOpenException(state);
        }
        if (participant.getAmount().compareTo(entranceFee) < 0) {
            throw new InsufficientDepositException(participant.getAmount(), entranceFee);
        }
        ledger.add(participant);
    }

    /**
     * OPEN -> CALCULATING. Participants stay in place until the fulfillment arrives.
     *
     * @throws RaffleNotOpenException if already CALCULATING
     */
    public void startDraw(long requestId) {
        if (state != RaffleState.OPEN) {
            throw new RaffleNotOpenException(state);
        }
        this.state = RaffleState.CALCULATING;
        this.pendingRequestId = requestId;
    }

    /**
     * Fails without touching anything unless a draw is pending under {@code requestId}.
     */
    public void requirePending(long requestId) {
        if (state != RaffleState.CALCULATING || pendingRequestId == null) {
            throw new NoPendingDrawException(requestId);
        }
        if (pendingRequestId != requestId) {
            throw new UnknownRandomnessRequestException(requestId);
        }
    }

    /**
     * CALCULATING -> OPEN. Picks {@code randomWord mod players} as the winner, records it and resets the
     * round. Modulo bias is accepted: the selection is not exactly uniform when the random domain is not a
     * multiple of the player count.
     *
     * @return the winner and the pool it is owed; the caller performs the transfer
     */
    public DrawOutcome completeDraw(long requestId, BigInteger randomWord, Instant now) {
        requirePending(requestId);
        Objects.requireNonNull(randomWord, "randomWord must not be null");
        final int players = ledger.size();
        if (players == 0) {
            throw new IllegalStateException("Draw pending with no participants, requestId=" + requestId);
        }

        final int winnerIndex = randomWord.mod(BigInteger.valueOf(players)).intValueExact();
        final String winner = ledger.participantAt(winnerIndex).getPlayer();
        final BigDecimal payout = ledger.getPoolBalance();
        final long finishedRound = roundNumber;

        this.recentWinner = winner;
        this.state = RaffleState.OPEN;
        this.pendingRequestId = null;
        this.lastDrawTimestamp = now;
        this.roundNumber = roundNumber + 1;
        ledger.clear();

        return new DrawOutcome(requestId, winnerIndex, winner, payout, finishedRound);
    }

    public RoundCheckpoint checkpoint() {
        return new RoundCheckpoint(state, pendingRequestId, recentWinner, lastDrawTimestamp, roundNumber,
                new ArrayList<>(ledger.view()), ledger.getPoolBalance());
    }

    /** Puts every round field back to the captured values. */
    public void restore(RoundCheckpoint checkpoint) {
        this.state = checkpoint.state();
        this.pendingRequestId = checkpoint.pendingRequestId();
        this.recentWinner = checkpoint.recentWinner();
        this.lastDrawTimestamp = checkpoint.lastDrawTimestamp();
        this.roundNumber = checkpoint.roundNumber();
        ledger.replaceWith(checkpoint.participants(), checkpoint.poolBalance());
    }

    public record DrawOutcome(long requestId, int winnerIndex, String winner, BigDecimal payout, long roundNumber) {
    }

    public record RoundCheckpoint(RaffleState state,
                                  Long pendingRequestId,
                                  String recentWinner,
                                  Instant lastDrawTimestamp,
                                  long roundNumber,
                                  List<Participant> participants,
                                  BigDecimal poolBalance) {
    }
}
