package com.nosota.msale.api.response;

import com.nosota.msale.api.model.AdmissionFailure;

/**
 * Result of evaluating the admission check without contributing.
 *
 * @param reason First failed condition, null when admitted
 */
public record AdmissionResponse(
        Long saleId,
        String contributor,
        Long amount,
        boolean admitted,
        AdmissionFailure reason
) {}
