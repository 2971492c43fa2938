package com.nosota.msale.external;

/**
 * Reward-unit ledger a sale issues into.
 *
 * <p>The sale never stores balances itself. Implementations taking part in the caller's
 * transaction roll back together with the sale operation that called them.
 */
public interface RewardLedger {

    /**
     * Credits newly created units to an account.
     *
     * @throws com.nosota.msale.error.IssuanceFrozenException after {@link #freezeIssuance()}
     */
    void issue(String account, long amount);

    /**
     * Moves units between two accounts.
     *
     * @return false if {@code from} does not hold {@code amount}; nothing moves in that case
     */
    boolean transfer(String from, String to, long amount);

    long balanceOf(String account);

    /**
     * Stops all further issuance. One-way.
     */
    void freezeIssuance();

    /**
     * Wires the account that issues into this ledger. A ledger serves one issuer at a time;
     * wiring the current issuer again changes nothing.
     *
     * @throws com.nosota.msale.error.RewardBookUnavailableException if another issuer is wired
     *                                                               or issuance is frozen
     */
    void setLedgerReference(String issuer);

    /**
     * Unwires {@code issuer} so another sale may bind the ledger. Ignored if it is not the wired issuer.
     */
    void clearLedgerReference(String issuer);
}
