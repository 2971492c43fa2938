package com.nosota.msale.api.response;

/**
 * Response for reward balance query.
 */
public record BalanceResponse(
        String rewardBook,
        String account,
        Long balance
) {}
