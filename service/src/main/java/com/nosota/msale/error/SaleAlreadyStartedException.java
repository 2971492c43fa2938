package com.nosota.msale.error;

/**
 * Identity-binding setting changed after the sale window opened.
 */
public class SaleAlreadyStartedException extends RuntimeException {
    public SaleAlreadyStartedException(String message) {
        super(message);
    }

    public SaleAlreadyStartedException(String message, Throwable cause) {
        super(message, cause);
    }
}
