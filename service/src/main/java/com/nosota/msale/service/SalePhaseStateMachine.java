package com.nosota.msale.service;

import com.nosota.msale.api.model.SalePhase;
import com.nosota.msale.model.Sale;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a sale.
 *
 * <p>The phase is not stored. It is derived from the sale's state and the current time:
 * <pre>
 * NOT_STARTED → OPEN → CAP_REACHED  → FINALIZED
 *                    → TIME_EXPIRED → FINALIZED
 * </pre>
 *
 * <p>A sale that skips OPEN (nobody looked while it was open) may move straight from
 * NOT_STARTED to CAP_REACHED or TIME_EXPIRED. Raising the capacity or extending the end time
 * reopens an ended sale. FINALIZED is terminal and only reachable by explicit finalization.
 */
@Component
public class SalePhaseStateMachine {

    private static final Map<SalePhase, Set<SalePhase>> ALLOWED_TRANSITIONS = Map.of(
            SalePhase.NOT_STARTED, EnumSet.of(SalePhase.OPEN, SalePhase.CAP_REACHED, SalePhase.TIME_EXPIRED),
            SalePhase.OPEN, EnumSet.of(SalePhase.CAP_REACHED, SalePhase.TIME_EXPIRED),
            SalePhase.CAP_REACHED, EnumSet.of(SalePhase.OPEN, SalePhase.FINALIZED),
            SalePhase.TIME_EXPIRED, EnumSet.of(SalePhase.OPEN, SalePhase.FINALIZED),
            SalePhase.FINALIZED, EnumSet.noneOf(SalePhase.class)
    );

    /**
     * Derives the phase of a sale at the given instant.
     * Finalization wins over everything, a reached capacity wins over an expired window.
     */
    public SalePhase resolve(Sale sale, Instant now) {
        if (sale.isFinalized()) {
            return SalePhase.FINALIZED;
        }
        if (!sale.getWindow().hasStarted(now)) {
            return SalePhase.NOT_STARTED;
        }
        if (sale.hasEnded(now)) {
            return sale.isCapReached() ? SalePhase.CAP_REACHED : SalePhase.TIME_EXPIRED;
        }
        return SalePhase.OPEN;
    }

    public boolean isTransitionAllowed(SalePhase from, SalePhase to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED_TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public void validateTransition(SalePhase from, SalePhase to) {
        if (!isTransitionAllowed(from, to)) {
            throw new IllegalStateException(
                    String.format("Invalid sale phase transition: %s → %s. Allowed transitions from %s: %s",
                            from, to, from, getAllowedTransitions(from)));
        }
    }

    public boolean isFinalState(SalePhase phase) {
        return phase == SalePhase.FINALIZED;
    }

    public Set<SalePhase> getAllowedTransitions(SalePhase from) {
        if (from == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(ALLOWED_TRANSITIONS.getOrDefault(from, Collections.emptySet()));
    }
}
