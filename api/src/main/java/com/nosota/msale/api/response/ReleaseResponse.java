package com.nosota.msale.api.response;

/**
 * Response for a vested reward release. {@code released} is false when the interval could not advance yet.
 */
public record ReleaseResponse(
        Long saleId,
        boolean released,
        Integer currentInterval
) {}
