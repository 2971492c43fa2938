package com.nosota.msale.api.response;

/**
 * Response for a direct issue or a bonus allocation.
 *
 * <p>{@code vestedAmount} and {@code allocationIndex} are only set for bonus allocations.
 */
public record IssueResponse(
        Long saleId,
        String beneficiary,
        Long deliveredAmount,
        Long administratorAmount,
        Long vestedAmount,
        Integer allocationIndex,
        Long totalRaised
) {}
