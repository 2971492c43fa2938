package com.nosota.msale.model;

/**
 * Outcome of claiming an allocation in the current interval.
 *
 * <p>{@code shouldRelease} is true at most once per allocation and interval. When false the
 * beneficiary and amount still describe the current interval, so callers can report them.
 *
 * @param shouldRelease Whether the caller must deliver {@code amount} to {@code beneficiary}
 * @param beneficiary   Allocation beneficiary
 * @param amount        Reward of the current interval
 */
public record ClaimResult(boolean shouldRelease, String beneficiary, long amount) {

    public static ClaimResult release(String beneficiary, long amount) {
        return new ClaimResult(true, beneficiary, amount);
    }

    public static ClaimResult alreadyClaimed(String beneficiary, long amount) {
        return new ClaimResult(false, beneficiary, amount);
    }
}
