package com.nosota.msale.tests;

import com.nosota.msale.TestBase;
import com.nosota.msale.dto.IssueReceipt;
import com.nosota.msale.error.ScheduleClosedException;
import com.nosota.msale.error.UnauthorizedException;
import com.nosota.msale.model.Allocation;
import com.nosota.msale.model.Sale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for administrator issues: direct issues, bonus allocations and the release
 * of vested bonus shares.
 *
 * <p>Sale terms: rate 5, administrator rate 1, bonus 20%, four daily vesting intervals.
 */
@DisplayName("6. Bonus Allocation Tests")
public class BonusAllocationTest extends TestBase {

    private String admin;
    private String alice;
    private String book;
    private Sale sale;

    @BeforeEach
    void setUpSale() {
        admin = unique("admin");
        alice = unique("alice");
        book = openRewardBook();
        sale = createSale(admin, openAuthorizationList(admin), book);
    }

    @Test
    @DisplayName("BON-001: a reward of 1000 splits into 200 for the administrator, 200 vested and 800 delivered")
    void bonusSplit() {
        IssueReceipt receipt = saleService.createBonusAllocation(sale.getId(), admin, alice, 1000L);

        assertThat(receipt.administratorAmount()).isEqualTo(200L);
        assertThat(receipt.vestedAmount()).isEqualTo(200L);
        assertThat(receipt.deliveredAmount()).isEqualTo(800L);
        assertThat(receipt.allocationIndex()).isZero();

        assertThat(balance(book, admin)).isEqualTo(200L);
        assertThat(balance(book, alice)).isEqualTo(800L);
        assertThat(balance(book, sale.getTreasuryAccount())).isEqualTo(200L);

        List<Allocation> allocations = vestingLedgerService.getAllocations(sale.getVestingScheduleId());
        assertThat(allocations).hasSize(1);
        assertThat(allocations.get(0).getBeneficiary()).isEqualTo(alice);
        assertThat(allocations.get(0).getTotalAllocation()).isEqualTo(200L);

        // bonus allocations do not count as raised
        assertThat(saleService.getSale(sale.getId()).getTotalRaised()).isZero();
    }

    @Test
    @DisplayName("BON-002: vested shares are released interval by interval from the treasury")
    void releaseVestedShares() {
        String bob = unique("bob");
        saleService.createBonusAllocation(sale.getId(), admin, alice, 1000L);
        saleService.createBonusAllocation(sale.getId(), admin, bob, 505L);

        assertThat(saleService.releaseVestedRewards(sale.getId(), admin)).isFalse();

        moveIntoInterval(sale, 1);
        assertThat(saleService.releaseVestedRewards(sale.getId(), admin)).isTrue();
        assertThat(saleService.releaseVestedRewards(sale.getId(), admin)).isFalse();
        assertThat(balance(book, alice)).isEqualTo(800L + 50L);
        assertThat(balance(book, bob)).isEqualTo(404L + 25L);

        for (int interval = 2; interval <= NUM_INTERVALS; interval++) {
            moveIntoInterval(sale, interval);
            assertThat(saleService.releaseVestedRewards(sale.getId(), admin)).isTrue();
        }

        assertThat(balance(book, alice)).isEqualTo(1000L);
        assertThat(balance(book, bob)).isEqualTo(505L);
        assertThat(balance(book, sale.getTreasuryAccount())).isZero();
    }

    @Test
    @DisplayName("BON-003: direct issue adds reward / rate to the raised total")
    void directIssue() {
        String carol = unique("carol");

        IssueReceipt receipt = saleService.directIssue(sale.getId(), admin, carol, 1001L);

        assertThat(receipt.deliveredAmount()).isEqualTo(1001L);
        assertThat(receipt.administratorAmount()).isEqualTo(200L);
        assertThat(receipt.vestedAmount()).isZero();
        assertThat(receipt.allocationIndex()).isNull();
        assertThat(receipt.totalRaised()).isEqualTo(200L);
        assertThat(balance(book, carol)).isEqualTo(1001L);
        assertThat(balance(book, admin)).isEqualTo(200L);
    }

    @Test
    @DisplayName("BON-004: a bonus allocation after the unlock date leaves no trace")
    void closedScheduleRollsBack() {
        moveIntoInterval(sale, 1);

        assertThatThrownBy(() -> saleService.createBonusAllocation(sale.getId(), admin, alice, 1000L))
                .isInstanceOf(ScheduleClosedException.class);

        assertThat(balance(book, admin)).isZero();
        assertThat(balance(book, alice)).isZero();
        assertThat(balance(book, sale.getTreasuryAccount())).isZero();
    }

    @Test
    @DisplayName("BON-005: only the administrator issues")
    void administratorOnly() {
        assertThatThrownBy(() -> saleService.createBonusAllocation(sale.getId(), alice, alice, 1000L))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> saleService.directIssue(sale.getId(), alice, alice, 1000L))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> saleService.releaseVestedRewards(sale.getId(), alice))
                .isInstanceOf(UnauthorizedException.class);
    }
}
