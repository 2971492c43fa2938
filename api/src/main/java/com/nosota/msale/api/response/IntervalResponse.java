package com.nosota.msale.api.response;

/**
 * Response for an interval advance attempt.
 */
public record IntervalResponse(
        Long scheduleId,
        boolean advanced,
        Integer currentInterval
) {}
