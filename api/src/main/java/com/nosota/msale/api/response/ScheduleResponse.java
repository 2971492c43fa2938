package com.nosota.msale.api.response;

import java.time.Instant;

/**
 * Response describing a vesting schedule.
 */
public record ScheduleResponse(
        Long scheduleId,
        String administrator,
        Instant unlockDate,
        Long intervalSeconds,
        Integer numIntervals,
        Integer currentInterval,
        Integer allocationCount
) {}
