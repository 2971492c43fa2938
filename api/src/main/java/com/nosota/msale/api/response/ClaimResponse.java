package com.nosota.msale.api.response;

/**
 * Response for a claim. {@code shouldRelease} is false when the allocation was already claimed in this interval.
 */
public record ClaimResponse(
        Long scheduleId,
        Integer index,
        boolean shouldRelease,
        String beneficiary,
        Long amount
) {}
