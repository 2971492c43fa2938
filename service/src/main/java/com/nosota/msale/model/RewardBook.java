package com.nosota.msale.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A named reward-unit ledger. Balances live in {@link RewardBalance}, movements in {@link RewardEntry}.
 *
 * <p>Freezing issuance is one-way.
 */
@Entity
@Table(name = "reward_book")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class RewardBook {
    @Id
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * Account wired as the issuing authority of this book, recorded on every issue entry.
     */
    @Column(name = "issuer")
    private String issuer;

    @Column(name = "issuance_frozen", nullable = false)
    private boolean issuanceFrozen;

    @Column(name = "frozen_at")
    private Instant frozenAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
