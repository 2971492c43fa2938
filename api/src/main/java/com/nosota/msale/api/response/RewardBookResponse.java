package com.nosota.msale.api.response;

public record RewardBookResponse(
        String name,
        String issuer,
        boolean issuanceFrozen
) {}
