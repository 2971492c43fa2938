package com.nosota.msale.api.response;

import com.nosota.msale.api.model.SalePhase;

import java.time.Instant;

/**
 * Snapshot of a sale's state together with its phase at the moment of the request.
 */
public record SaleResponse(
        Long saleId,
        String administrator,
        String pendingAdministrator,
        String treasuryAccount,
        Instant startTime,
        Instant endTime,
        Long rate,
        Long administratorRate,
        Long bonusPercent,
        Long capacity,
        Long minContribution,
        Long maxContribution,
        Long totalRaised,
        boolean finalized,
        Instant finalizedAt,
        Long vestingScheduleId,
        String authorizationList,
        String rewardBook,
        SalePhase phase
) {}
