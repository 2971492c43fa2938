package com.nosota.msale.tests;

import com.nosota.msale.TestBase;
import com.nosota.msale.api.model.AdmissionFailure;
import com.nosota.msale.dto.ContributionReceipt;
import com.nosota.msale.error.ContributionRejectedException;
import com.nosota.msale.error.IssuanceFrozenException;
import com.nosota.msale.model.Sale;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for contributions and the admission check.
 *
 * <p>Sale terms (see {@link TestBase#saleRequest}): rate 5, administrator rate 1, capacity 1000,
 * contributions between 1 and 500 per participant.
 */
@DisplayName("5. Contribution Tests")
public class ContributionTest extends TestBase {

    private String admin;
    private String alice;
    private String bob;
    private String book;
    private Sale sale;

    @BeforeEach
    void setUpSale() {
        admin = unique("admin");
        alice = unique("alice");
        bob = unique("bob");
        book = openRewardBook();
        String list = openAuthorizationList(admin, alice, bob);
        sale = createSale(admin, list, book);
        moveToOpenWindow(sale);
    }

    private void assertRejected(String contributor, long amount, AdmissionFailure reason) {
        assertThatThrownBy(() -> saleService.acceptContribution(sale.getId(), contributor, amount))
                .isInstanceOf(ContributionRejectedException.class)
                .extracting("reason").isEqualTo(reason);
        assertThat(saleService.admissionCheck(sale.getId(), contributor, amount)).contains(reason);
    }

    @Test
    @DisplayName("CON-001: contribution of 10 at rate 5 issues 50 to the contributor and 10 to the administrator")
    void rewardsAreIssued() {
        ContributionReceipt receipt = saleService.acceptContribution(sale.getId(), alice, 10L);

        assertThat(receipt.contributorReward()).isEqualTo(50L);
        assertThat(receipt.administratorReward()).isEqualTo(10L);
        assertThat(receipt.totalRaised()).isEqualTo(10L);
        assertThat(balance(book, alice)).isEqualTo(50L);
        assertThat(balance(book, admin)).isEqualTo(10L);
        assertThat(saleService.getSale(sale.getId()).getTotalRaised()).isEqualTo(10L);
    }

    @Test
    @DisplayName("CON-002: no contributions before or after the window")
    void windowClosed() {
        clock.setInstant(sale.getWindow().getStartTime().minusSeconds(1));
        assertRejected(alice, 10L, AdmissionFailure.WINDOW_CLOSED);

        moveAfterWindow(sale);
        assertRejected(alice, 10L, AdmissionFailure.WINDOW_CLOSED);

        assertThat(balance(book, alice)).isZero();
    }

    @Test
    @DisplayName("CON-003: total raised never exceeds the capacity")
    void capacityEnforced() {
        saleService.acceptContribution(sale.getId(), alice, 500L);
        saleService.acceptContribution(sale.getId(), bob, 499L);

        assertRejected(bob, 2L, AdmissionFailure.CAPACITY_EXCEEDED);

        saleService.acceptContribution(sale.getId(), bob, 1L);
        assertThat(saleService.getSale(sale.getId()).getTotalRaised()).isEqualTo(1000L);
        assertRejected(bob, 1L, AdmissionFailure.CAPACITY_EXCEEDED);
    }

    @Test
    @DisplayName("CON-004: unauthorized accounts are rejected")
    void notAuthorized() {
        String mallory = unique("mallory");

        assertRejected(mallory, 10L, AdmissionFailure.NOT_AUTHORIZED);
        assertThat(balance(book, mallory)).isZero();
    }

    @Test
    @DisplayName("CON-005: contributions below the minimum are rejected")
    void belowMinimum() {
        String list = openAuthorizationList(admin, alice);
        Sale strictSale = saleAdministrationService.createSale(admin, saleRequest(list, openRewardBook(), 1000L, 20L, 500L));
        moveToOpenWindow(strictSale);

        assertThatThrownBy(() -> saleService.acceptContribution(strictSale.getId(), alice, 19L))
                .isInstanceOf(ContributionRejectedException.class);
        assertThat(saleService.admissionCheck(strictSale.getId(), alice, 19L)).contains(AdmissionFailure.BELOW_MINIMUM);
        assertThat(saleService.admissionCheck(strictSale.getId(), alice, 20L)).isEmpty();
    }

    @Test
    @DisplayName("CON-006: cumulative contributions per participant are capped by the maximum")
    void aboveMaximum() {
        saleService.acceptContribution(sale.getId(), alice, 300L);

        assertRejected(alice, 201L, AdmissionFailure.ABOVE_MAXIMUM);

        saleService.acceptContribution(sale.getId(), alice, 200L);
        assertThat(balance(book, alice)).isEqualTo(2500L);
    }

    @Test
    @DisplayName("CON-007: rejected contributions change nothing")
    void rejectionIsAtomic() {
        saleService.acceptContribution(sale.getId(), alice, 100L);
        long raisedBefore = saleService.getSale(sale.getId()).getTotalRaised();

        assertRejected(alice, 401L, AdmissionFailure.ABOVE_MAXIMUM);

        assertThat(saleService.getSale(sale.getId()).getTotalRaised()).isEqualTo(raisedBefore);
        assertThat(balance(book, alice)).isEqualTo(500L);
        assertThat(balance(book, admin)).isEqualTo(100L);
    }

    @Test
    @DisplayName("CON-008: a failing ledger aborts the whole contribution")
    void ledgerFailureRollsBack() {
        rewardBookService.freezeIssuance(book);

        assertThatThrownBy(() -> saleService.acceptContribution(sale.getId(), alice, 10L))
                .isInstanceOf(IssuanceFrozenException.class);

        assertThat(saleService.getSale(sale.getId()).getTotalRaised()).isZero();
        assertThat(balance(book, alice)).isZero();
    }

    @Test
    @DisplayName("CON-009: non-positive amounts are invalid")
    void nonPositiveAmount() {
        assertThatThrownBy(() -> saleService.acceptContribution(sale.getId(), alice, 0L))
                .isInstanceOf(ConstraintViolationException.class);
    }
}
