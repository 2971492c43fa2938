package com.nosota.msale.service;

import com.nosota.msale.api.model.SaleEventType;
import com.nosota.msale.api.model.SalePhase;
import com.nosota.msale.api.request.CreateSaleRequest;
import com.nosota.msale.error.AuthorizationListNotFoundException;
import com.nosota.msale.error.RewardBookNotFoundException;
import com.nosota.msale.error.RewardBookUnavailableException;
import com.nosota.msale.error.SaleAlreadyStartedException;
import com.nosota.msale.error.SaleFinalizedException;
import com.nosota.msale.error.SaleNotFoundException;
import com.nosota.msale.error.UnauthorizedException;
import com.nosota.msale.external.AuthorizationOracleProvider;
import com.nosota.msale.external.RewardLedgerProvider;
import com.nosota.msale.model.Sale;
import com.nosota.msale.model.SaleEvent;
import com.nosota.msale.model.SaleWindow;
import com.nosota.msale.model.VestingSchedule;
import com.nosota.msale.repository.SaleEventRepository;
import com.nosota.msale.repository.SaleRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Creation and configuration of sales.
 *
 * <p>Setters are administrator-only. The setters that rebind a collaborator (authorization
 * list, vesting schedule, reward book) are additionally refused once the sale has started:
 * <ul>
 *   <li>{@link #setAuthorizationList}</li>
 *   <li>{@link #setVestingSchedule}</li>
 *   <li>{@link #setRewardBook}</li>
 * </ul>
 *
 * <p>Administration moves to another account in two steps: the administrator nominates it,
 * then the nominee accepts.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class SaleAdministrationService {

    private final SaleRepository saleRepository;
    private final SaleEventRepository saleEventRepository;
    private final VestingLedgerService vestingLedgerService;
    private final SalePhaseStateMachine salePhaseStateMachine;
    private final AuthorizationOracleProvider authorizationOracleProvider;
    private final RewardLedgerProvider rewardLedgerProvider;
    private final Clock clock;

    @Value("${sale.treasury-prefix:sale:}")
    private String treasuryPrefix;

    /**
     * Creates a sale administered by {@code administrator}.
     *
     * <p>The sale gets its own treasury account and a fresh vesting schedule administered by
     * that treasury. The treasury is also wired as the issuer of the reward book.
     *
     * @param administrator Creating account, becomes the administrator
     * @param request       Sale parameters
     * @return The created sale
     * @throws IllegalArgumentException       if the window or the contribution bounds are inconsistent
     * @throws RewardBookUnavailableException if the book issues for another sale or is frozen
     */
    @Transactional
    public Sale createSale(@NotBlank String administrator, @NotNull @Valid CreateSaleRequest request) {
        Instant now = clock.instant();

        if (!request.endTime().isAfter(request.startTime())) {
            throw new IllegalArgumentException("End time " + request.endTime() + " must be after start time " + request.startTime());
        }
        if (request.minContribution() > request.maxContribution()) {
            throw new IllegalArgumentException("Minimum contribution " + request.minContribution()
                    + " exceeds maximum contribution " + request.maxContribution());
        }
        requireAuthorizationList(request.authorizationList());
        requireRewardBook(request.rewardBook());

        Sale sale = new Sale();
        sale.setAdministrator(administrator);
        sale.setWindow(new SaleWindow(request.startTime(), request.endTime()));
        sale.setRate(request.rate());
        sale.setAdministratorRate(request.administratorRate());
        sale.setBonusPercent(request.bonusPercent());
        sale.setCapacity(request.capacity());
        sale.setMinContribution(request.minContribution());
        sale.setMaxContribution(request.maxContribution());
        sale.setTotalRaised(0L);
        sale.setAuthorizationList(request.authorizationList());
        sale.setRewardBook(request.rewardBook());
        sale.setCreatedAt(now);
        sale = saleRepository.save(sale);

        String treasury = treasuryPrefix + sale.getId();
        Long scheduleId = vestingLedgerService.createSchedule(treasury, request.unlockDate(),
                Duration.ofSeconds(request.intervalSeconds()), request.numIntervals(), now);
        rewardLedgerProvider.resolve(request.rewardBook()).setLedgerReference(treasury);

        sale.setTreasuryAccount(treasury);
        sale.setVestingScheduleId(scheduleId);
        sale = saleRepository.save(sale);

        recordEvent(sale, SaleEventType.SALE_CREATED, administrator, "scheduleId=" + scheduleId, now);
        log.info("Created sale: id={}, administrator={}, window=[{}, {}], rate={}, capacity={}, scheduleId={}",
                sale.getId(), administrator, request.startTime(), request.endTime(), request.rate(),
                request.capacity(), scheduleId);
        return sale;
    }

    /**
     * Rebinds the authorization list. Only before the sale starts.
     *
     * @throws SaleAlreadyStartedException          if the sale has started
     * @throws AuthorizationListNotFoundException if the list does not exist
     */
    @Transactional
    public Sale setAuthorizationList(@NotNull Long saleId, @NotBlank String caller, @NotBlank String name) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);
        requireNotStarted(sale, now);
        requireAuthorizationList(name);

        sale.setAuthorizationList(name);
        return update(sale, "authorizationList=" + name, now);
    }

    /**
     * Rebinds the vesting schedule. Only before the sale starts, and only to a schedule
     * administered by the sale's treasury account.
     *
     * @throws SaleAlreadyStartedException if the sale has started
     * @throws IllegalArgumentException    if the schedule is administered by another account
     */
    @Transactional
    public Sale setVestingSchedule(@NotNull Long saleId, @NotBlank String caller, @NotNull Long scheduleId) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);
        requireNotStarted(sale, now);

        VestingSchedule schedule = vestingLedgerService.getSchedule(scheduleId);
        if (!schedule.getAdministrator().equals(sale.getTreasuryAccount())) {
            throw new IllegalArgumentException("Vesting schedule " + scheduleId + " must be administered by "
                    + sale.getTreasuryAccount() + ", not " + schedule.getAdministrator());
        }

        sale.setVestingScheduleId(scheduleId);
        return update(sale, "vestingScheduleId=" + scheduleId, now);
    }

    /**
     * Rebinds the reward book and wires the sale's treasury as its issuer, releasing the previous
     * book. Only before the sale starts.
     *
     * @throws SaleAlreadyStartedException     if the sale has started
     * @throws RewardBookNotFoundException     if the book does not exist
     * @throws RewardBookUnavailableException if the book issues for another sale or is frozen
     */
    @Transactional
    public Sale setRewardBook(@NotNull Long saleId, @NotBlank String caller, @NotBlank String name) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);
        requireNotStarted(sale, now);
        requireRewardBook(name);

        if (!name.equals(sale.getRewardBook())) {
            rewardLedgerProvider.resolve(name).setLedgerReference(sale.getTreasuryAccount());
            rewardLedgerProvider.resolve(sale.getRewardBook()).clearLedgerReference(sale.getTreasuryAccount());
        }
        sale.setRewardBook(name);
        return update(sale, "rewardBook=" + name, now);
    }

    /**
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    @Transactional
    public Sale setCapacity(@NotNull Long saleId, @NotBlank String caller, long capacity) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);

        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }

        sale.setCapacity(capacity);
        return update(sale, "capacity=" + capacity, now);
    }

    @Transactional
    public Sale setMaxContribution(@NotNull Long saleId, @NotBlank String caller, @PositiveOrZero long maxContribution) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);

        sale.setMaxContribution(maxContribution);
        return update(sale, "maxContribution=" + maxContribution, now);
    }

    /**
     * Moves the end of the sale window.
     *
     * @throws SaleFinalizedException   if the sale is finalized
     * @throws IllegalArgumentException if the end time is not after the start time
     */
    @Transactional
    public Sale setEndTime(@NotNull Long saleId, @NotBlank String caller, @NotNull Instant endTime) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);

        if (sale.isFinalized()) {
            throw new SaleFinalizedException("Sale " + saleId + " is finalized");
        }
        if (!endTime.isAfter(sale.getWindow().getStartTime())) {
            throw new IllegalArgumentException("End time " + endTime + " must be after start time "
                    + sale.getWindow().getStartTime());
        }

        sale.getWindow().setEndTime(endTime);
        return update(sale, "endTime=" + endTime, now);
    }

    /**
     * Nominates a new administrator. Takes effect once the nominee accepts; nominating again
     * replaces the pending nominee.
     */
    @Transactional
    public Sale transferAdministration(@NotNull Long saleId, @NotBlank String caller, @NotBlank String newAdministrator) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);
        sale.requireAdministrator(caller);

        sale.setPendingAdministrator(newAdministrator);
        sale.setUpdatedAt(now);
        sale = saleRepository.save(sale);

        recordEvent(sale, SaleEventType.ADMINISTRATION_TRANSFER_STARTED, newAdministrator, "from=" + caller, now);
        log.info("Sale {} administration transfer started: {} → {}", saleId, caller, newAdministrator);
        return sale;
    }

    /**
     * @throws UnauthorizedException if the caller is not the pending administrator
     */
    @Transactional
    public Sale acceptAdministration(@NotNull Long saleId, @NotBlank String caller) {
        Instant now = clock.instant();
        Sale sale = lockSale(saleId);

        if (!caller.equals(sale.getPendingAdministrator())) {
            throw new UnauthorizedException("Account " + caller + " is not the pending administrator of sale " + saleId);
        }

        String previous = sale.getAdministrator();
        sale.setAdministrator(caller);
        sale.setPendingAdministrator(null);
        sale.setUpdatedAt(now);
        sale = saleRepository.save(sale);

        recordEvent(sale, SaleEventType.ADMINISTRATION_TRANSFERRED, caller, "from=" + previous, now);
        log.info("Sale {} administration transferred: {} → {}", saleId, previous, caller);
        return sale;
    }

    public Sale getSale(@NotNull Long saleId) {
        return saleRepository.findById(saleId)
                .orElseThrow(() -> new SaleNotFoundException("Sale not found: " + saleId));
    }

    public SalePhase getPhase(@NotNull Sale sale) {
        return salePhaseStateMachine.resolve(sale, clock.instant());
    }

    /**
     * Events of the sale, including the events of its vesting schedule, oldest first.
     */
    public List<SaleEvent> getSaleEvents(@NotNull Long saleId) {
        Sale sale = getSale(saleId);
        return saleEventRepository.findBySaleIdOrScheduleIdOrderByIdAsc(saleId, sale.getVestingScheduleId());
    }

    private Sale update(Sale sale, String detail, Instant now) {
        sale.setUpdatedAt(now);
        Sale saved = saleRepository.save(sale);
        recordEvent(saved, SaleEventType.SALE_UPDATED, null, detail, now);
        log.info("Updated sale {}: {}", saved.getId(), detail);
        return saved;
    }

    private void recordEvent(Sale sale, SaleEventType type, String account, String detail, Instant now) {
        saleEventRepository.save(SaleEvent.builder()
                .saleId(sale.getId())
                .type(type)
                .account(account)
                .detail(detail)
                .createdAt(now)
                .build());
    }

    private void requireNotStarted(Sale sale, Instant now) {
        if (sale.getWindow().hasStarted(now)) {
            throw new SaleAlreadyStartedException("Sale " + sale.getId() + " started at "
                    + sale.getWindow().getStartTime() + "; its collaborators can no longer be changed");
        }
    }

    private void requireAuthorizationList(String name) {
        if (!authorizationOracleProvider.exists(name)) {
            throw new AuthorizationListNotFoundException("Authorization list not found: " + name);
        }
    }

    private void requireRewardBook(String name) {
        if (!rewardLedgerProvider.exists(name)) {
            throw new RewardBookNotFoundException("Reward book not found: " + name);
        }
    }

    private Sale lockSale(Long saleId) {
        Sale sale = saleRepository.getOneForUpdate(saleId);
        if (sale == null) {
            throw new SaleNotFoundException("Sale not found: " + saleId);
        }
        return sale;
    }
}
