package com.nosota.msale.api.model;

/**
 * Phase of a sale, derived from its window, its raised total and the finalization flag.
 *
 * <p>Lifecycle:
 * <pre>
 * NOT_STARTED → OPEN → CAP_REACHED  ─┐
 *                    → TIME_EXPIRED ─┴→ FINALIZED
 * </pre>
 */
public enum SalePhase {
    /**
     * Current time is before the configured start. Identity-binding settings may still change.
     */
    NOT_STARTED,

    /**
     * Window is open and capacity is not exhausted. Contributions are admitted.
     */
    OPEN,

    /**
     * Total raised reached the capacity. Admission has ended.
     */
    CAP_REACHED,

    /**
     * End time has passed. Admission has ended.
     */
    TIME_EXPIRED,

    /**
     * Sale was finalized explicitly. Terminal: issuance is frozen and the flag never resets.
     */
    FINALIZED
}
