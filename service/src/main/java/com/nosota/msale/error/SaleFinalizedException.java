package com.nosota.msale.error;

/**
 * Issuance or reconfiguration attempted on a finalized sale.
 */
public class SaleFinalizedException extends RuntimeException {
    public SaleFinalizedException(String message) {
        super(message);
    }

    public SaleFinalizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
