package com.nosota.msale.model;

/**
 * Kind of movement recorded in a reward book.
 */
public enum RewardEntryType {
    /**
     * New units credited to an account. No source account.
     */
    ISSUE,

    /**
     * Units moved between two accounts of the same book.
     */
    TRANSFER
}
