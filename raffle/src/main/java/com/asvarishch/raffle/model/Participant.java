package com.asvarishch.raffle.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One accepted entry of the current round. The whole sent amount is recorded,
 * including anything above the entrance fee.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode
@Embeddable
public class Participant {

    @Column(name = "player", length = 128, nullable = false)
    private String player;

    @Column(name = "amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal amount;

    @Column(name = "entered_at", nullable = false)
    private Instant enteredAt;
}
