package com.nosota.msale.service;

import com.nosota.msale.api.model.AdmissionFailure;
import com.nosota.msale.api.model.SaleEventType;
import com.nosota.msale.api.model.SalePhase;
import com.nosota.msale.dto.ContributionReceipt;
import com.nosota.msale.dto.IssueReceipt;
import com.nosota.msale.error.AlreadyFinalizedException;
import com.nosota.msale.error.ContributionRejectedException;
import com.nosota.msale.error.RewardTransferFailedException;
import com.nosota.msale.error.SaleFinalizedException;
import com.nosota.msale.error.SaleNotEndedException;
import com.nosota.msale.error.SaleNotFoundException;
import com.nosota.msale.external.AuthorizationOracleProvider;
import com.nosota.msale.external.RewardLedger;
import com.nosota.msale.external.RewardLedgerProvider;
import com.nosota.msale.model.ClaimResult;
import com.nosota.msale.model.Sale;
import com.nosota.msale.model.SaleEvent;
import com.nosota.msale.repository.SaleEventRepository;
import com.nosota.msale.repository.SaleRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Sale controller: admits contributions, converts them into reward units and routes bonus
 * shares into the sale's vesting schedule.
 *
 * <p>Reward units move only through the {@link RewardLedger} the sale is bound to:
 * <ul>
 *   <li>Contributions and direct issues: issued straight to the beneficiary and the administrator</li>
 *   <li>Bonus allocations: the bonus share is issued to the sale's treasury account and
 *       registered as an allocation; {@link #releaseVestedRewards} later transfers vested
 *       installments from the treasury to the beneficiaries</li>
 * </ul>
 *
 * <p>Every operation runs in one transaction and starts by locking the sale row, so operations
 * on one sale are applied one at a time and either take effect completely or not at all. A
 * failing ledger call or an overflowing computation rolls back every mutation of the operation.
 *
 * <p>Conditions that are simply not met yet (no interval to release) are reported as
 * {@code false}; everything else that prevents an operation is thrown.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class SaleService {

    private final SaleRepository saleRepository;
    private final SaleEventRepository saleEventRepository;
    private final VestingLedgerService vestingLedgerService;
    private final SalePhaseStateMachine salePhaseStateMachine;
    private final AuthorizationOracleProvider authorizationOracleProvider;
    private final RewardLedgerProvider rewardLedgerProvider;
    private final Clock clock;

    /**
     * Evaluates the admission check without contributing.
     *
     * @return The first failed condition, empty if the contribution would be admitted
     */
    public Optional<AdmissionFailure> admissionCheck(@NotNull Long saleId, @NotBlank String contributor,
                                                     @Positive long amount) {
        Sale sale = getSale(saleId);
        return admissionCheck(sale, contributor, amount, resolveLedger(sale), clock.instant());
    }

    /**
     * Accepts a contribution.
     *
     * <p>The contributor receives {@code amount × rate} reward units, the administrator
     * {@code amount × administratorRate}; the raised total grows by {@code amount}.
     *
     * @param saleId      Sale ID
     * @param contributor Contributing account
     * @param amount      Contributed amount
     * @return Issued rewards and the new raised total
     * @throws ContributionRejectedException if the admission check fails
     */
    @Transactional
    public ContributionReceipt acceptContribution(@NotNull Long saleId, @NotBlank String contributor,
                                                  @Positive long amount) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        RewardLedger ledger = resolveLedger(sale);

        Optional<AdmissionFailure> failure = admissionCheck(sale, contributor, amount, ledger, now);
        if (failure.isPresent()) {
            log.warn("Contribution rejected: saleId={}, contributor={}, amount={}, reason={}",
                    saleId, contributor, amount, failure.get());
            throw new ContributionRejectedException(failure.get(),
                    "Contribution of " + amount + " to sale " + saleId + " rejected: " + failure.get());
        }

        long contributorReward = Math.multiplyExact(amount, sale.getRate());
        long administratorReward = Math.multiplyExact(amount, sale.getAdministratorRate());
        long totalRaised = Math.addExact(sale.getTotalRaised(), amount);

        ledger.issue(contributor, contributorReward);
        if (administratorReward > 0) {
            ledger.issue(sale.getAdministrator(), administratorReward);
        }

        sale.setTotalRaised(totalRaised);
        sale.setUpdatedAt(now);
        saleRepository.save(sale);

        saleEventRepository.save(SaleEvent.builder()
                .saleId(saleId)
                .type(SaleEventType.CONTRIBUTION_ACCEPTED)
                .account(contributor)
                .amount(amount)
                .detail("contributorReward=" + contributorReward + ", administratorReward=" + administratorReward)
                .createdAt(now)
                .build());

        log.info("Accepted contribution: saleId={}, contributor={}, amount={}, reward={}, totalRaised={}",
                saleId, contributor, amount, contributorReward, totalRaised);
        return new ContributionReceipt(contributorReward, administratorReward, totalRaised);
    }

    /**
     * Issues reward units for a contribution vetted outside the sale. Bypasses the admission check.
     *
     * <p>The raised total grows by {@code rewardAmount / rate}; the administrator receives
     * {@code rewardAmount × administratorRate / rate}. Both divisions truncate.
     *
     * @throws SaleFinalizedException if the sale is finalized
     */
    @Transactional
    public IssueReceipt directIssue(@NotNull Long saleId, @NotBlank String caller, @NotBlank String beneficiary,
                                    @PositiveOrZero long rewardAmount) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);
        requireNotFinalized(sale);

        long contribution = rewardAmount / sale.getRate();
        long administratorShare = Math.multiplyExact(rewardAmount, sale.getAdministratorRate()) / sale.getRate();
        long totalRaised = Math.addExact(sale.getTotalRaised(), contribution);

        RewardLedger ledger = resolveLedger(sale);
        ledger.issue(beneficiary, rewardAmount);
        if (administratorShare > 0) {
            ledger.issue(sale.getAdministrator(), administratorShare);
        }

        sale.setTotalRaised(totalRaised);
        sale.setUpdatedAt(now);
        saleRepository.save(sale);

        saleEventRepository.save(SaleEvent.builder()
                .saleId(saleId)
                .type(SaleEventType.DIRECT_ISSUE)
                .account(beneficiary)
                .amount(rewardAmount)
                .detail("contribution=" + contribution + ", administratorShare=" + administratorShare)
                .createdAt(now)
                .build());

        log.info("Direct issue: saleId={}, beneficiary={}, rewardAmount={}, contribution={}, totalRaised={}",
                saleId, beneficiary, rewardAmount, contribution, totalRaised);
        return new IssueReceipt(rewardAmount, administratorShare, 0L, null, totalRaised);
    }

    /**
     * Issues a reward of which the bonus share vests.
     *
     * <p>Split of {@code rewardAmount}:
     * <ul>
     *   <li>administrator share {@code administratorRate × rewardAmount / rate}, issued now</li>
     *   <li>bonus share {@code bonusPercent × rewardAmount / 100}, issued to the treasury and
     *       registered as an allocation of the sale's vesting schedule</li>
     *   <li>remainder {@code rewardAmount − bonus share}, issued now to the beneficiary</li>
     * </ul>
     *
     * @throws SaleFinalizedException if the sale is finalized
     * @throws com.nosota.msale.error.ScheduleClosedException if the schedule already unlocked
     */
    @Transactional
    public IssueReceipt createBonusAllocation(@NotNull Long saleId, @NotBlank String caller,
                                              @NotBlank String beneficiary, @PositiveOrZero long rewardAmount) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);
        requireNotFinalized(sale);

        long administratorShare = Math.multiplyExact(sale.getAdministratorRate(), rewardAmount) / sale.getRate();
        long bonusShare = Math.multiplyExact(sale.getBonusPercent(), rewardAmount) / 100;
        long remainder = Math.subtractExact(rewardAmount, bonusShare);

        RewardLedger ledger = resolveLedger(sale);
        if (administratorShare > 0) {
            ledger.issue(sale.getAdministrator(), administratorShare);
        }
        if (bonusShare > 0) {
            ledger.issue(sale.getTreasuryAccount(), bonusShare);
        }
        int index = vestingLedgerService.createAllocation(
                sale.getVestingScheduleId(), sale.getTreasuryAccount(), beneficiary, bonusShare, now);
        if (remainder > 0) {
            ledger.issue(beneficiary, remainder);
        }

        sale.setUpdatedAt(now);
        saleRepository.save(sale);

        saleEventRepository.save(SaleEvent.builder()
                .saleId(saleId)
                .scheduleId(sale.getVestingScheduleId())
                .type(SaleEventType.BONUS_ALLOCATION_CREATED)
                .account(beneficiary)
                .amount(rewardAmount)
                .detail("index=" + index + ", bonus=" + bonusShare + ", delivered=" + remainder
                        + ", administratorShare=" + administratorShare)
                .createdAt(now)
                .build());

        log.info("Bonus allocation: saleId={}, beneficiary={}, rewardAmount={}, bonus={}, index={}",
                saleId, beneficiary, rewardAmount, bonusShare, index);
        return new IssueReceipt(remainder, administratorShare, bonusShare, index, sale.getTotalRaised());
    }

    /**
     * Advances the sale's vesting schedule and pays out the installments of the new interval.
     *
     * @return false if the schedule could not advance; nothing is released then
     * @throws RewardTransferFailedException if the treasury cannot cover an installment
     */
    @Transactional
    public boolean releaseVestedRewards(@NotNull Long saleId, @NotBlank String caller) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);
        return releaseVestedRewards(sale, now);
    }

    /**
     * Finalizes the sale once admission has ended.
     *
     * <p>Freezes issuance of the reward ledger and releases the first vested interval if one is
     * due. Finalization is irreversible.
     *
     * @return whether vested rewards were released during finalization
     * @throws AlreadyFinalizedException if the sale is already finalized
     * @throws SaleNotEndedException     if neither the capacity is reached nor the window expired
     */
    @Transactional
    public boolean finalizeSale(@NotNull Long saleId, @NotBlank String caller) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);

        SalePhase phase = salePhaseStateMachine.resolve(sale, now);
        if (phase == SalePhase.FINALIZED) {
            throw new AlreadyFinalizedException("Sale " + saleId + " is already finalized");
        }
        if (!salePhaseStateMachine.isTransitionAllowed(phase, SalePhase.FINALIZED)) {
            throw new SaleNotEndedException("Sale " + saleId + " cannot be finalized in phase " + phase);
        }

        boolean released = onFinalize(sale, now);

        sale.setFinalized(true);
        sale.setFinalizedAt(now);
        sale.setUpdatedAt(now);
        saleRepository.save(sale);

        saleEventRepository.save(SaleEvent.builder()
                .saleId(saleId)
                .type(SaleEventType.SALE_FINALIZED)
                .amount(sale.getTotalRaised())
                .detail("phase=" + phase + ", released=" + released)
                .createdAt(now)
                .build());

        log.info("Finalized sale {} from phase {}: totalRaised={}, released={}",
                saleId, phase, sale.getTotalRaised(), released);
        return released;
    }

    public Sale getSale(@NotNull Long saleId) {
        return saleRepository.findById(saleId)
                .orElseThrow(() -> new SaleNotFoundException("Sale not found: " + saleId));
    }

    /**
     * Runs once, right before the sale is marked finalized.
     */
    private boolean onFinalize(Sale sale, Instant now) {
        resolveLedger(sale).freezeIssuance();
        return releaseVestedRewards(sale, now);
    }

    private boolean releaseVestedRewards(Sale sale, Instant now) {
        String treasury = sale.getTreasuryAccount();
        Long scheduleId = sale.getVestingScheduleId();

        if (!vestingLedgerService.advanceInterval(scheduleId, treasury, now)) {
            log.debug("No vested rewards to release for sale {}", sale.getId());
            return false;
        }

        RewardLedger ledger = resolveLedger(sale);
        int interval = vestingLedgerService.getSchedule(scheduleId).getCurrentInterval();
        int count = vestingLedgerService.count(scheduleId);
        long releasedTotal = 0;

        for (int index = 0; index < count; index++) {
            ClaimResult claim = vestingLedgerService.claim(scheduleId, treasury, index, now);
            if (!claim.shouldRelease()) {
                continue;
            }

            if (!ledger.transfer(treasury, claim.beneficiary(), claim.amount())) {
                throw new RewardTransferFailedException("Could not transfer " + claim.amount() + " vested units from "
                        + treasury + " to " + claim.beneficiary() + " (allocation " + index + ")");
            }
            releasedTotal = Math.addExact(releasedTotal, claim.amount());

            saleEventRepository.save(SaleEvent.builder()
                    .saleId(sale.getId())
                    .scheduleId(scheduleId)
                    .type(SaleEventType.VESTED_REWARD_RELEASED)
                    .account(claim.beneficiary())
                    .amount(claim.amount())
                    .intervalNumber(interval)
                    .detail("index=" + index)
                    .createdAt(now)
                    .build());
        }

        log.info("Released vested rewards: saleId={}, interval={}, allocations={}, total={}",
                sale.getId(), interval, count, releasedTotal);
        return true;
    }

    /**
     * Conditions in the order {@link AdmissionFailure} declares them; the first failure is reported.
     */
    private Optional<AdmissionFailure> admissionCheck(Sale sale, String contributor, long amount,
                                                      RewardLedger ledger, Instant now) {
        if (sale.isFinalized() || !sale.getWindow().isOpen(now)) {
            return Optional.of(AdmissionFailure.WINDOW_CLOSED);
        }
        if (Math.addExact(sale.getTotalRaised(), amount) > sale.getCapacity()) {
            return Optional.of(AdmissionFailure.CAPACITY_EXCEEDED);
        }
        if (!authorizationOracleProvider.resolve(sale.getAuthorizationList()).isAuthorized(contributor)) {
            return Optional.of(AdmissionFailure.NOT_AUTHORIZED);
        }
        if (amount < sale.getMinContribution()) {
            return Optional.of(AdmissionFailure.BELOW_MINIMUM);
        }
        long alreadyContributed = ledger.balanceOf(contributor) / sale.getRate();
        if (Math.addExact(amount, alreadyContributed) > sale.getMaxContribution()) {
            return Optional.of(AdmissionFailure.ABOVE_MAXIMUM);
        }
        return Optional.empty();
    }

    private void requireNotFinalized(Sale sale) {
        if (sale.isFinalized()) {
            throw new SaleFinalizedException("Sale " + sale.getId() + " is finalized");
        }
    }

    private RewardLedger resolveLedger(Sale sale) {
        return rewardLedgerProvider.resolve(sale.getRewardBook());
    }

    private Sale lockSale(Long saleId) {
        Sale sale = saleRepository.getOneForUpdate(saleId);
        if (sale == null) {
            throw new SaleNotFoundException("Sale not found: " + saleId);
        }
        return sale;
    }
}
