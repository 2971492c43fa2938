package com.nosota.msale.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;

/**
 * Request for creating a standalone vesting schedule.
 *
 * @param administrator   Account allowed to operate the schedule; the caller when omitted
 * @param unlockDate      Moment after which intervals may advance
 * @param intervalSeconds Length of one interval in seconds
 * @param numIntervals    Number of intervals
 */
public record CreateScheduleRequest(
        String administrator,

        @NotNull(message = "Unlock date is required")
        Instant unlockDate,

        @NotNull @Positive
        Long intervalSeconds,

        @NotNull @Positive
        Integer numIntervals
) {
}
