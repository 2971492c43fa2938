package com.nosota.msale.api.response;

/**
 * Response for an accepted contribution.
 */
public record ContributionResponse(
        Long saleId,
        String contributor,
        Long amount,
        Long contributorReward,
        Long administratorReward,
        Long totalRaised
) {}
