package com.nosota.msale.error;

/**
 * Caller does not hold the capability an operation requires (administrator, pending administrator, list owner).
 */
public class UnauthorizedException extends RuntimeException {
    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
