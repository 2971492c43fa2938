package com.nosota.msale.api.response;

public record AuthorizationListResponse(
        String name,
        String owner,
        Long size
) {}
