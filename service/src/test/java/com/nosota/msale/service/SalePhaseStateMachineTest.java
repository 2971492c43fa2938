package com.nosota.msale.service;

import com.nosota.msale.api.model.SalePhase;
import com.nosota.msale.model.Sale;
import com.nosota.msale.model.SaleWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("3. Sale phase state machine")
class SalePhaseStateMachineTest {

    private static final Instant START = Instant.parse("2030-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2030-01-02T00:00:00Z");

    private final SalePhaseStateMachine stateMachine = new SalePhaseStateMachine();
    private Sale sale;

    @BeforeEach
    void setUp() {
        sale = new Sale();
        sale.setWindow(new SaleWindow(START, END));
        sale.setCapacity(100L);
        sale.setTotalRaised(0L);
    }

    @Test
    @DisplayName("PHS-001: phase follows the clock")
    void phaseFollowsTime() {
        assertThat(stateMachine.resolve(sale, START.minusSeconds(1))).isEqualTo(SalePhase.NOT_STARTED);
        assertThat(stateMachine.resolve(sale, START)).isEqualTo(SalePhase.OPEN);
        assertThat(stateMachine.resolve(sale, END)).isEqualTo(SalePhase.OPEN);
        assertThat(stateMachine.resolve(sale, END.plusSeconds(1))).isEqualTo(SalePhase.TIME_EXPIRED);
        assertThat(sale.hasEnded(END)).isFalse();
        assertThat(sale.hasEnded(END.plusSeconds(1))).isTrue();
    }

    @Test
    @DisplayName("PHS-002: reaching the capacity ends admission before the window closes")
    void capReached() {
        sale.setTotalRaised(100L);

        assertThat(stateMachine.resolve(sale, START.plusSeconds(10))).isEqualTo(SalePhase.CAP_REACHED);
        assertThat(stateMachine.resolve(sale, END.plusSeconds(1))).isEqualTo(SalePhase.CAP_REACHED);
        assertThat(sale.hasEnded(START.plusSeconds(10))).isTrue();
    }

    @Test
    @DisplayName("PHS-003: finalization wins over every other condition")
    void finalizedWins() {
        sale.setFinalized(true);

        assertThat(stateMachine.resolve(sale, START.minusSeconds(1))).isEqualTo(SalePhase.FINALIZED);
        assertThat(stateMachine.isFinalState(SalePhase.FINALIZED)).isTrue();
        assertThat(stateMachine.getAllowedTransitions(SalePhase.FINALIZED)).isEmpty();
    }

    @Test
    @DisplayName("PHS-004: only ended sales may be finalized")
    void finalizationTransitions() {
        assertThat(stateMachine.isTransitionAllowed(SalePhase.CAP_REACHED, SalePhase.FINALIZED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(SalePhase.TIME_EXPIRED, SalePhase.FINALIZED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(SalePhase.OPEN, SalePhase.FINALIZED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(SalePhase.NOT_STARTED, SalePhase.FINALIZED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(null, SalePhase.FINALIZED)).isFalse();

        assertThatThrownBy(() -> stateMachine.validateTransition(SalePhase.OPEN, SalePhase.FINALIZED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPEN → FINALIZED");
    }
}
