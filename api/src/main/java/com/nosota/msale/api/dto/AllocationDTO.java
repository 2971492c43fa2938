package com.nosota.msale.api.dto;

/**
 * Vesting bookkeeping of one allocation.
 *
 * @param index               Stable position inside its schedule
 * @param beneficiary         Account receiving the vested units
 * @param totalAllocation     Amount fixed at creation
 * @param remainingBalance    Amount not released yet
 * @param lastClaimedInterval Last interval in which the allocation was claimed
 * @param currentReward       Amount claimable for the current interval
 */
public record AllocationDTO(
        Integer index,
        String beneficiary,
        Long totalAllocation,
        Long remainingBalance,
        Integer lastClaimedInterval,
        Long currentReward
) {}
