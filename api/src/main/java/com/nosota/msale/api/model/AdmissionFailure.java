package com.nosota.msale.api.model;

/**
 * Reason a contribution was rejected by the admission check.
 * Conditions are evaluated in declaration order; the first one that fails is reported.
 */
public enum AdmissionFailure {
    WINDOW_CLOSED,
    CAPACITY_EXCEEDED,
    NOT_AUTHORIZED,
    BELOW_MINIMUM,
    ABOVE_MAXIMUM
}
