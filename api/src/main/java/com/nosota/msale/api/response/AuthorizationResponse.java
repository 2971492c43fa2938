package com.nosota.msale.api.response;

/**
 * Response for an authorization query against a list.
 */
public record AuthorizationResponse(
        String authorizationList,
        String account,
        boolean authorized
) {}
