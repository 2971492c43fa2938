package com.nosota.msale.error;

/**
 * Second call to finalize a sale.
 */
public class AlreadyFinalizedException extends RuntimeException {
    public AlreadyFinalizedException(String message) {
        super(message);
    }

    public AlreadyFinalizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
