package com.nosota.msale.error;

/**
 * Finalization attempted while the sale is still admitting contributions.
 */
public class SaleNotEndedException extends RuntimeException {
    public SaleNotEndedException(String message) {
        super(message);
    }

    public SaleNotEndedException(String message, Throwable cause) {
        super(message, cause);
    }
}
