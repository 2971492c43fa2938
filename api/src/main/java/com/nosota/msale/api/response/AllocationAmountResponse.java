package com.nosota.msale.api.response;

public record AllocationAmountResponse(
        Long scheduleId,
        Integer index,
        Long amount
) {}
