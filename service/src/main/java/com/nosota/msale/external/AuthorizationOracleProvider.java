package com.nosota.msale.external;

/**
 * Resolves the authorization oracle a sale is bound to by name.
 */
public interface AuthorizationOracleProvider {

    boolean exists(String name);

    /**
     * @throws com.nosota.msale.error.AuthorizationListNotFoundException if no oracle has that name
     */
    AuthorizationOracle resolve(String name);
}
