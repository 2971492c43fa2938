package com.nosota.msale.error;

/**
 * Issue attempted on a reward book whose issuance is frozen.
 */
public class IssuanceFrozenException extends RuntimeException {
    public IssuanceFrozenException(String message) {
        super(message);
    }

    public IssuanceFrozenException(String message, Throwable cause) {
        super(message, cause);
    }
}
