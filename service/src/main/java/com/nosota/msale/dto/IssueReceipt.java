package com.nosota.msale.dto;

/**
 * Outcome of a direct issue or a bonus allocation.
 *
 * @param deliveredAmount     Units issued to the beneficiary right away
 * @param administratorAmount Units issued to the administrator
 * @param vestedAmount        Units reserved in the vesting schedule, 0 for direct issues
 * @param allocationIndex     Index of the created allocation, null for direct issues
 * @param totalRaised         Raised total after the operation
 */
public record IssueReceipt(long deliveredAmount, long administratorAmount, long vestedAmount,
                           Integer allocationIndex, long totalRaised) {
}
