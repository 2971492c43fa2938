package com.nosota.msale.api.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * Request for creating a sale together with the vesting schedule it drives.
 *
 * <p>The caller becomes the sale administrator.
 *
 * @param startTime         Start of the contribution window (inclusive)
 * @param endTime           End of the contribution window (inclusive)
 * @param rate              Reward units issued per contributed unit
 * @param administratorRate Reward units issued to the administrator per contributed unit
 * @param bonusPercent      Share (0..100) of a bonus allocation that is vested instead of delivered
 * @param capacity          Maximum cumulative contribution
 * @param minContribution   Minimum single contribution
 * @param maxContribution   Maximum cumulative contribution per participant
 * @param unlockDate        Moment after which vesting intervals may advance
 * @param intervalSeconds   Length of one vesting interval in seconds
 * @param numIntervals      Number of vesting intervals
 * @param authorizationList Name of the authorization list deciding who may contribute
 * @param rewardBook        Name of the reward book that holds reward units
 */
public record CreateSaleRequest(
        @NotNull(message = "Start time is required")
        Instant startTime,

        @NotNull(message = "End time is required")
        Instant endTime,

        @NotNull @Positive(message = "Rate must be positive")
        Long rate,

        @NotNull @PositiveOrZero
        Long administratorRate,

        @NotNull @PositiveOrZero @Max(100)
        Long bonusPercent,

        @NotNull @Positive(message = "Capacity must be positive")
        Long capacity,

        @NotNull @PositiveOrZero
        Long minContribution,

        @NotNull @PositiveOrZero
        Long maxContribution,

        @NotNull(message = "Unlock date is required")
        Instant unlockDate,

        @NotNull @Positive
        Long intervalSeconds,

        @NotNull @Positive
        Integer numIntervals,

        @NotBlank(message = "Authorization list is required")
        String authorizationList,

        @NotBlank(message = "Reward book is required")
        String rewardBook
) {
}
