package com.nosota.msale.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request for contributing to a sale. The contributor is the calling account.
 *
 * @param amount Contributed amount (in minor units)
 */
public record ContributionRequest(
        @NotNull @Positive(message = "Amount must be positive")
        Long amount
) {
}
