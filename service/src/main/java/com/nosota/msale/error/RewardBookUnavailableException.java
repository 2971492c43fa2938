package com.nosota.msale.error;

/**
 * Reward book cannot be bound to a sale: it already issues for another sale's treasury,
 * or its issuance is frozen.
 */
public class RewardBookUnavailableException extends RuntimeException {
    public RewardBookUnavailableException(String message) {
        super(message);
    }

    public RewardBookUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
