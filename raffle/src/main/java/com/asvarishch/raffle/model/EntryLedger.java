package com.asvarishch.raffle.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Participants of the current round in entry order, plus the sum of their deposits.
 * Entry order is the index space used by winner selection. Only {@link Raffle} mutates it.
 */
@NoArgsConstructor
@ToString
@Embeddable
public class EntryLedger {

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "raffle_participants", joinColumns = @JoinColumn(name = "raffle_id"))
    @OrderColumn(name = "entry_index")
    private List<Participant> participants = new ArrayList<>();

    @Getter
    @Column(name = "pool_balance", precision = 38, scale = 18, nullable = false)
    private BigDecimal poolBalance = BigDecimal.ZERO;

    void add(Participant participant) {
        participants.add(participant);
        poolBalance = poolBalance.add(participant.getAmount());
    }

    public int size() {
        return participants.size();
    }

    public boolean isEmpty() {
        return participants.isEmpty();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, size())}
     */
    public Participant participantAt(int index) {
        return participants.get(index);
    }

    public List<Participant> getParticipants() {
        return view();
    }

    public List<Participant> view() {
        return Collections.unmodifiableList(participants);
    }

    /** Empties the participant list and zeroes the pool. */
    void clear() {
        participants.clear();
        poolBalance = BigDecimal.ZERO;
    }

    void replaceWith(List<Participant> snapshot, BigDecimal balance) {
        participants.clear();
        participants.addAll(snapshot);
        poolBalance = balance;
    }
}
