package com.nosota.msale.service;

import com.nosota.msale.api.model.SaleEventType;
import com.nosota.msale.error.AllocationIndexOutOfRangeException;
import com.nosota.msale.error.ScheduleClosedException;
import com.nosota.msale.error.VestingScheduleNotFoundException;
import com.nosota.msale.model.Allocation;
import com.nosota.msale.model.ClaimResult;
import com.nosota.msale.model.SaleEvent;
import com.nosota.msale.model.VestingSchedule;
import com.nosota.msale.repository.AllocationRepository;
import com.nosota.msale.repository.SaleEventRepository;
import com.nosota.msale.repository.VestingScheduleRepository;
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
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Vesting ledger: holds allocations that unlock in equal installments over fixed intervals
 * after an unlock date.
 *
 * <p>Lifecycle of a schedule:
 * <ul>
 *   <li>Before {@code unlockDate}: allocations may be registered, nothing can be claimed</li>
 *   <li>After {@code unlockDate}: the interval counter advances by one per successful
 *       {@link #advanceInterval} call, each advance recomputes every allocation's current reward</li>
 *   <li>In every interval each allocation can be claimed once; the final interval pays out the
 *       whole remaining balance</li>
 * </ul>
 *
 * <p>The ledger never moves reward units itself. {@link #claim} only tells the caller what to
 * deliver and to whom.
 *
 * <p>Every mutating operation locks the schedule row first, which serializes index assignment,
 * interval advances and claims of one schedule. Operations that depend on time take a single
 * {@code now} snapshot; overloads without it read the injected {@link Clock}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class VestingLedgerService {

    private final VestingScheduleRepository vestingScheduleRepository;
    private final AllocationRepository allocationRepository;
    private final SaleEventRepository saleEventRepository;
    private final Clock clock;

    /**
     * Creates a vesting schedule.
     *
     * @param administrator    Account holding the administrator capability
     * @param unlockDate       Instant after which intervals start elapsing
     * @param intervalDuration Length of one interval, positive
     * @param numIntervals     Number of intervals, at least 1
     * @param now              Creation time
     * @return ID of the new schedule
     */
    @Transactional
    public Long createSchedule(@NotBlank String administrator, @NotNull Instant unlockDate,
                               @NotNull Duration intervalDuration, @Positive int numIntervals,
                               @NotNull Instant now) {
        VestingSchedule schedule = new VestingSchedule(administrator, unlockDate, intervalDuration, numIntervals, now);
        schedule = vestingScheduleRepository.save(schedule);

        log.info("Created vesting schedule: id={}, administrator={}, unlockDate={}, interval={}, numIntervals={}",
                schedule.getId(), administrator, unlockDate, intervalDuration, numIntervals);
        return schedule.getId();
    }

    @Transactional
    public Long createSchedule(@NotBlank String administrator, @NotNull Instant unlockDate,
                               @NotNull Duration intervalDuration, @Positive int numIntervals) {
        return createSchedule(administrator, unlockDate, intervalDuration, numIntervals, clock.instant());
    }

    /**
     * Registers a new allocation. Only allowed strictly before the unlock date.
     *
     * @param scheduleId  Schedule ID
     * @param caller      Must be the schedule administrator
     * @param beneficiary Account that will receive the vested units
     * @param amount      Total units to vest
     * @param now         Current time snapshot
     * @return Index of the new allocation, equal to the number of allocations before the call
     * @throws ScheduleClosedException if {@code now} is at or after the unlock date
     */
    @Transactional
    public int createAllocation(@NotNull Long scheduleId, @NotBlank String caller, @NotBlank String beneficiary,
                                @PositiveOrZero long amount, @NotNull Instant now) {
        VestingSchedule schedule = lockSchedule(scheduleId);
        schedule.requireAdministrator(caller);

        if (!schedule.isOpenForAllocations(now)) {
            throw new ScheduleClosedException("Vesting schedule " + scheduleId + " unlocked at "
                    + schedule.getUnlockDate() + " and accepts no more allocations");
        }

        int index = Math.toIntExact(allocationRepository.countByScheduleId(scheduleId));
        Allocation allocation = allocationRepository.save(new Allocation(scheduleId, index, beneficiary, amount));

        saleEventRepository.save(SaleEvent.builder()
                .scheduleId(scheduleId)
                .type(SaleEventType.ALLOCATION_CREATED)
                .account(beneficiary)
                .amount(amount)
                .detail("index=" + index)
                .createdAt(now)
                .build());

        log.info("Created allocation: scheduleId={}, index={}, beneficiary={}, amount={}",
                scheduleId, allocation.getAllocationIndex(), beneficiary, amount);
        return index;
    }

    @Transactional
    public int createAllocation(@NotNull Long scheduleId, @NotBlank String caller, @NotBlank String beneficiary,
                                @PositiveOrZero long amount) {
        return createAllocation(scheduleId, caller, beneficiary, amount, clock.instant());
    }

    /**
     * Moves the schedule to the next interval if its boundary has been passed.
     *
     * <p>Returns false without changing anything when there is nothing to advance: before the
     * unlock date, before the next boundary, or after the final interval was reached.
     *
     * @param scheduleId Schedule ID
     * @param caller     Must be the schedule administrator
     * @param now        Current time snapshot
     * @return true if the interval counter moved
     */
    @Transactional
    public boolean advanceInterval(@NotNull Long scheduleId, @NotBlank String caller, @NotNull Instant now) {
        VestingSchedule schedule = lockSchedule(scheduleId);
        schedule.requireAdministrator(caller);

        if (!schedule.canAdvance(now)) {
            log.debug("Vesting schedule {} cannot advance at {} (interval {}/{})",
                    scheduleId, now, schedule.getCurrentInterval(), schedule.getNumIntervals());
            return false;
        }

        int interval = schedule.advance();
        vestingScheduleRepository.save(schedule);

        List<Allocation> allocations = allocationRepository.findByScheduleIdOrderByAllocationIndexAsc(scheduleId);
        for (Allocation allocation : allocations) {
            allocation.recomputeReward(interval, schedule.getNumIntervals());
        }
        allocationRepository.saveAll(allocations);

        saleEventRepository.save(SaleEvent.builder()
                .scheduleId(scheduleId)
                .type(SaleEventType.INTERVAL_ADVANCED)
                .intervalNumber(interval)
                .createdAt(now)
                .build());

        log.info("Vesting schedule {} advanced to interval {}/{} ({} allocations)",
                scheduleId, interval, schedule.getNumIntervals(), allocations.size());
        return true;
    }

    @Transactional
    public boolean advanceInterval(@NotNull Long scheduleId, @NotBlank String caller) {
        return advanceInterval(scheduleId, caller, clock.instant());
    }

    /**
     * Claims the current reward of an allocation.
     *
     * <p>The first claim in an interval drains the reward from the allocation and returns a
     * release instruction. Any further claim in the same interval, and any claim before the
     * first interval, returns {@code shouldRelease = false}.
     *
     * @param scheduleId Schedule ID
     * @param caller     Must be the schedule administrator
     * @param index      Allocation index
     * @param now        Current time snapshot
     * @return What the caller must deliver
     * @throws AllocationIndexOutOfRangeException if no allocation has that index
     * @throws ArithmeticException                if the reward exceeds the remaining balance
     */
    @Transactional
    public ClaimResult claim(@NotNull Long scheduleId, @NotBlank String caller, int index, @NotNull Instant now) {
        VestingSchedule schedule = lockSchedule(scheduleId);
        schedule.requireAdministrator(caller);

        Allocation allocation = findAllocation(scheduleId, index);
        ClaimResult result = allocation.claim(schedule.getCurrentInterval());
        if (!result.shouldRelease()) {
            return result;
        }

        allocationRepository.save(allocation);
        saleEventRepository.save(SaleEvent.builder()
                .scheduleId(scheduleId)
                .type(SaleEventType.ALLOCATION_CLAIMED)
                .account(result.beneficiary())
                .amount(result.amount())
                .intervalNumber(schedule.getCurrentInterval())
                .detail("index=" + index)
                .createdAt(now)
                .build());

        log.info("Claimed allocation: scheduleId={}, index={}, interval={}, amount={}, remaining={}",
                scheduleId, index, schedule.getCurrentInterval(), result.amount(), allocation.getRemainingBalance());
        return result;
    }

    @Transactional
    public ClaimResult claim(@NotNull Long scheduleId, @NotBlank String caller, int index) {
        return claim(scheduleId, caller, index, clock.instant());
    }

    /**
     * @return Number of allocations of the schedule
     */
    public int count(@NotNull Long scheduleId) {
        getSchedule(scheduleId);
        return Math.toIntExact(allocationRepository.countByScheduleId(scheduleId));
    }

    /**
     * @return Total amount the allocation was created with
     * @throws AllocationIndexOutOfRangeException if no allocation has that index
     */
    public long allocationAmount(@NotNull Long scheduleId, int index) {
        getSchedule(scheduleId);
        return findAllocation(scheduleId, index).getTotalAllocation();
    }

    public VestingSchedule getSchedule(@NotNull Long scheduleId) {
        return vestingScheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new VestingScheduleNotFoundException("Vesting schedule not found: " + scheduleId));
    }

    public List<Allocation> getAllocations(@NotNull Long scheduleId) {
        getSchedule(scheduleId);
        return allocationRepository.findByScheduleIdOrderByAllocationIndexAsc(scheduleId);
    }

    private VestingSchedule lockSchedule(Long scheduleId) {
        VestingSchedule schedule = vestingScheduleRepository.getOneForUpdate(scheduleId);
        if (schedule == null) {
            throw new VestingScheduleNotFoundException("Vesting schedule not found: " + scheduleId);
        }
        return schedule;
    }

    private Allocation findAllocation(Long scheduleId, int index) {
        return allocationRepository.findByScheduleIdAndAllocationIndex(scheduleId, index)
                .orElseThrow(() -> new AllocationIndexOutOfRangeException(
                        scheduleId, index, allocationRepository.countByScheduleId(scheduleId)));
    }
}
