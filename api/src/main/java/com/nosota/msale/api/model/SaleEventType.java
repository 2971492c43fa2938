package com.nosota.msale.api.model;

/**
 * Type of an audit record written by the sale and vesting services.
 */
public enum SaleEventType {
    SALE_CREATED,
    ALLOCATION_CREATED,
    INTERVAL_ADVANCED,
    ALLOCATION_CLAIMED,
    CONTRIBUTION_ACCEPTED,
    DIRECT_ISSUE,
    BONUS_ALLOCATION_CREATED,
    VESTED_REWARD_RELEASED,
    SALE_FINALIZED,
    SALE_UPDATED,
    ADMINISTRATION_TRANSFER_STARTED,
    ADMINISTRATION_TRANSFERRED
}
