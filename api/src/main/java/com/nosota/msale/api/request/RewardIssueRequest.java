package com.nosota.msale.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Administrator request issuing reward units to a beneficiary outside the contribution path.
 * Used both for direct issues and for bonus allocations.
 *
 * @param beneficiary  Receiving account
 * @param rewardAmount Reward units
 */
public record RewardIssueRequest(
        @NotBlank(message = "Beneficiary is required")
        String beneficiary,

        @NotNull @Positive(message = "Reward amount must be positive")
        Long rewardAmount
) {
}
