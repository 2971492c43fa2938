package com.nosota.msale.error;

import com.nosota.msale.api.model.AdmissionFailure;

/**
 * Contribution failed the admission check. Nothing was issued and the raised total is unchanged.
 */
public class ContributionRejectedException extends RuntimeException {
    private final AdmissionFailure reason;

    public ContributionRejectedException(AdmissionFailure reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AdmissionFailure getReason() {
        return reason;
    }
}
