package com.nosota.msale.error;

/**
 * Reward ledger refused a transfer the sale relies on. Aborts the enclosing operation.
 */
public class RewardTransferFailedException extends RuntimeException {
    public RewardTransferFailedException(String message) {
        super(message);
    }

    public RewardTransferFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
