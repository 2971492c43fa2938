package com.nosota.msale.dto;

/**
 * Outcome of an accepted contribution.
 *
 * @param contributorReward   Units issued to the contributor
 * @param administratorReward Units issued to the administrator
 * @param totalRaised         Raised total after the contribution
 */
public record ContributionReceipt(long contributorReward, long administratorReward, long totalRaised) {
}
