package com.nosota.msale.api;

import com.nosota.msale.api.dto.AllocationDTO;
import com.nosota.msale.api.request.CreateAllocationRequest;
import com.nosota.msale.api.request.CreateScheduleRequest;
import com.nosota.msale.api.response.AllocationAmountResponse;
import com.nosota.msale.api.response.AllocationCountResponse;
import com.nosota.msale.api.response.ClaimResponse;
import com.nosota.msale.api.response.IntervalResponse;
import com.nosota.msale.api.response.ScheduleResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Vesting ledger API interface.
 *
 * <p>Low-level operations on a vesting schedule: allocation registration, interval
 * advancement and per-allocation claims. Sales drive their own schedule through
 * {@link SaleApi#releaseVestedRewards}; these endpoints serve schedules operated directly.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>VestingController - in service module</li>
 *   <li>VestingClient - in api module</li>
 * </ul>
 */
@RequestMapping("/api/v1/vesting-schedules")
public interface VestingApi {

    @PostMapping
    ResponseEntity<ScheduleResponse> createSchedule(
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestBody @Valid CreateScheduleRequest request);

    @GetMapping("/{scheduleId}")
    ResponseEntity<ScheduleResponse> getSchedule(@PathVariable("scheduleId") Long scheduleId);

    /**
     * Registers an allocation. Only allowed before the unlock date.
     *
     * @return The allocation with its index
     */
    @PostMapping("/{scheduleId}/allocations")
    ResponseEntity<AllocationDTO> createAllocation(
            @PathVariable("scheduleId") Long scheduleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestBody @Valid CreateAllocationRequest request);

    @GetMapping("/{scheduleId}/allocations")
    ResponseEntity<List<AllocationDTO>> getAllocations(@PathVariable("scheduleId") Long scheduleId);

    @GetMapping("/{scheduleId}/allocations/count")
    ResponseEntity<AllocationCountResponse> count(@PathVariable("scheduleId") Long scheduleId);

    @GetMapping("/{scheduleId}/allocations/{index}/amount")
    ResponseEntity<AllocationAmountResponse> allocationAmount(
            @PathVariable("scheduleId") Long scheduleId,
            @PathVariable("index") Integer index);

    /**
     * Advances the interval counter when the next interval boundary has passed.
     * Returns {@code advanced=false} otherwise.
     */
    @PostMapping("/{scheduleId}/advance")
    ResponseEntity<IntervalResponse> advanceInterval(
            @PathVariable("scheduleId") Long scheduleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller);

    /**
     * Claims the current interval's reward of an allocation.
     * Returns {@code shouldRelease=false} when it was already claimed in this interval.
     */
    @PostMapping("/{scheduleId}/allocations/{index}/claim")
    ResponseEntity<ClaimResponse> claim(
            @PathVariable("scheduleId") Long scheduleId,
            @PathVariable("index") Integer index,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller);
}
