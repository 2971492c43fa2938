package com.nosota.msale.error;

public class RewardBookNotFoundException extends RuntimeException {
    public RewardBookNotFoundException(String message) {
        super(message);
    }

    public RewardBookNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
