package com.nosota.msale.error;

public class AuthorizationListNotFoundException extends RuntimeException {
    public AuthorizationListNotFoundException(String message) {
        super(message);
    }

    public AuthorizationListNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
