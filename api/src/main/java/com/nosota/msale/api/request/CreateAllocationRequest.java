package com.nosota.msale.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * @param beneficiary Account receiving the vested units
 * @param amount      Total allocation
 */
public record CreateAllocationRequest(
        @NotBlank(message = "Beneficiary is required")
        String beneficiary,

        @NotNull @PositiveOrZero
        Long amount
) {
}
