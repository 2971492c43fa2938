package com.nosota.msale.external;

/**
 * Decides which accounts may contribute to a sale. Pure query.
 */
public interface AuthorizationOracle {

    boolean isAuthorized(String account);
}
