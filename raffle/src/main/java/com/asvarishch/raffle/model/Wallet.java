package com.asvarishch.raffle.model;

import com.asvarishch.raffle.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Balance held for a player address. Payouts credit it; a wallet with
 * {@code acceptsFunds = false} rejects incoming transfers.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "address", callSuper = false)
@Entity
@Table(name = "wallets")
public class Wallet extends AuditableEntity {

    @Id
    @Column(name = "address", length = 128, nullable = false)
    private String address;

    @Column(name = "balance", precision = 38, scale = 18, nullable = false)
    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    @Column(name = "accepts_funds", nullable = false)
    @Builder.Default
    private boolean acceptsFunds = true;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public void credit(BigDecimal amount) {
        this.balance = balance.add(amount);
    }
}
