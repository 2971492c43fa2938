package com.nosota.msale.model;

import com.nosota.msale.error.UnauthorizedException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Sale state owned by the sale controller.
 *
 * <p>Holds the admission bounds, the conversion ratios, the raised total and references to the
 * collaborators the sale is bound to (vesting schedule, authorization list, reward book).
 * {@code totalRaised} never decreases and {@code finalized} never resets.
 */
@Entity
@Table(name = "sale")
@Getter
@Setter
@NoArgsConstructor
public class Sale {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "administrator", nullable = false)
    private String administrator;

    /**
     * Account nominated by {@code transferAdministration}, null when no transfer is pending.
     */
    @Column(name = "pending_administrator")
    private String pendingAdministrator;

    /**
     * The sale's own reward account. Holds reserved bonus units until they vest and acts as
     * administrator of the bound vesting schedule.
     */
    @Column(name = "treasury_account")
    private String treasuryAccount;

    @Embedded
    private SaleWindow window;

    /**
     * Reward units issued per contributed unit. Always positive.
     */
    @Column(name = "rate", nullable = false)
    private Long rate;

    @Column(name = "administrator_rate", nullable = false)
    private Long administratorRate;

    @Column(name = "bonus_percent", nullable = false)
    private Long bonusPercent;

    @Column(name = "capacity", nullable = false)
    private Long capacity;

    @Column(name = "min_contribution", nullable = false)
    private Long minContribution;

    @Column(name = "max_contribution", nullable = false)
    private Long maxContribution;

    @Column(name = "total_raised", nullable = false)
    private Long totalRaised = 0L;

    @Column(name = "finalized", nullable = false)
    private boolean finalized;

    @Column(name = "finalized_at")
    private Instant finalizedAt;

    @Column(name = "vesting_schedule_id")
    private Long vestingScheduleId;

    @Column(name = "authorization_list", nullable = false)
    private String authorizationList;

    @Column(name = "reward_book", nullable = false)
    private String rewardBook;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public void requireAdministrator(String caller) {
        if (!administrator.equals(caller)) {
            throw new UnauthorizedException("Account " + caller + " is not the administrator of sale " + id);
        }
    }

    public boolean isCapReached() {
        return totalRaised >= capacity;
    }

    /**
     * Admission is over once the capacity is exhausted or the window has expired.
     */
    public boolean hasEnded(Instant now) {
        return isCapReached() || window.hasExpired(now);
    }
}
