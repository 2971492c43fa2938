package com.nosota.msale.external;

/**
 * Resolves the reward ledger a sale is bound to by name.
 */
public interface RewardLedgerProvider {

    boolean exists(String name);

    /**
     * @throws com.nosota.msale.error.RewardBookNotFoundException if no ledger has that name
     */
    RewardLedger resolve(String name);
}
