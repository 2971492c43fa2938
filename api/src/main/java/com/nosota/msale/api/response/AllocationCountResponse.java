package com.nosota.msale.api.response;

public record AllocationCountResponse(
        Long scheduleId,
        Integer count
) {}
