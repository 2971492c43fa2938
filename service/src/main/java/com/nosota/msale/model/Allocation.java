package com.nosota.msale.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A beneficiary's vesting entry inside a {@link VestingSchedule}.
 *
 * <p>Allocations form a growth-only list per schedule. {@code allocationIndex} is assigned
 * densely at creation and is the allocation's identity towards callers; entries are never
 * reordered or removed, only drained towards zero.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code 0 <= remainingBalance <= totalAllocation}</li>
 *   <li>Released amounts add up to {@code totalAllocation} once the final interval is claimed</li>
 * </ul>
 */
@Entity
@Table(name = "allocation",
        uniqueConstraints = @UniqueConstraint(columnNames = {"schedule_id", "allocation_index"}))
@Getter
@Setter
@NoArgsConstructor
public class Allocation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_id", nullable = false)
    private Long scheduleId;

    @Column(name = "allocation_index", nullable = false)
    private Integer allocationIndex;

    @Column(name = "beneficiary", nullable = false)
    private String beneficiary;

    /**
     * Fixed at creation.
     */
    @Column(name = "total_allocation", nullable = false)
    private Long totalAllocation;

    /**
     * Not yet released. Starts at {@code totalAllocation}, never increases.
     */
    @Column(name = "remaining_balance", nullable = false)
    private Long remainingBalance;

    @Column(name = "last_claimed_interval", nullable = false)
    private Integer lastClaimedInterval;

    /**
     * Claimable amount of the schedule's current interval. Recomputed on every advance.
     */
    @Column(name = "current_reward", nullable = false)
    private Long currentReward;

    public Allocation(Long scheduleId, int allocationIndex, String beneficiary, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Allocation amount must not be negative: " + amount);
        }
        this.scheduleId = scheduleId;
        this.allocationIndex = allocationIndex;
        this.beneficiary = beneficiary;
        this.totalAllocation = amount;
        this.remainingBalance = amount;
        this.lastClaimedInterval = 0;
        this.currentReward = 0L;
    }

    /**
     * Recomputes the reward for a newly reached interval.
     *
     * <p>Regular intervals pay {@code totalAllocation / numIntervals}, truncated. The final
     * interval pays the whole remaining balance, which absorbs every truncation remainder.
     *
     * @param currentInterval Interval just reached (1-based)
     * @param numIntervals    Total number of intervals of the schedule
     */
    public void recomputeReward(int currentInterval, int numIntervals) {
        if (currentInterval == numIntervals) {
            currentReward = remainingBalance;
        } else {
            currentReward = totalAllocation / numIntervals;
        }
    }

    /**
     * Claims the current reward once per interval.
     *
     * @param currentInterval Current interval of the schedule
     * @return release instruction, or an already-claimed result when claimed in this interval
     * @throws ArithmeticException if the reward exceeds the remaining balance
     */
    public ClaimResult claim(int currentInterval) {
        if (lastClaimedInterval >= currentInterval) {
            return ClaimResult.alreadyClaimed(beneficiary, currentReward);
        }

        long remaining = Math.subtractExact(remainingBalance, currentReward);
        if (remaining < 0) {
            throw new ArithmeticException("Allocation " + allocationIndex + " of schedule " + scheduleId
                    + " would underflow: remaining=" + remainingBalance + ", reward=" + currentReward);
        }

        lastClaimedInterval = currentInterval;
        remainingBalance = remaining;
        return ClaimResult.release(beneficiary, currentReward);
    }
}
