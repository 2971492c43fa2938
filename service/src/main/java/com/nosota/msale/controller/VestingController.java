package com.nosota.msale.controller;

import com.nosota.msale.api.VestingApi;
import com.nosota.msale.api.dto.AllocationDTO;
import com.nosota.msale.api.request.CreateAllocationRequest;
import com.nosota.msale.api.request.CreateScheduleRequest;
import com.nosota.msale.api.response.AllocationAmountResponse;
import com.nosota.msale.api.response.AllocationCountResponse;
import com.nosota.msale.api.response.ClaimResponse;
import com.nosota.msale.api.response.IntervalResponse;
import com.nosota.msale.api.response.ScheduleResponse;
import com.nosota.msale.mapper.SaleMapper;
import com.nosota.msale.model.ClaimResult;
import com.nosota.msale.model.VestingSchedule;
import com.nosota.msale.service.VestingLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class VestingController implements VestingApi {

    private final VestingLedgerService vestingLedgerService;

    @Override
    public ResponseEntity<ScheduleResponse> createSchedule(String caller, CreateScheduleRequest request) {
        String administrator = request.administrator() != null ? request.administrator() : caller;
        Long scheduleId = vestingLedgerService.createSchedule(administrator, request.unlockDate(),
                Duration.ofSeconds(request.intervalSeconds()), request.numIntervals());
        return ResponseEntity.status(HttpStatus.CREATED).body(toScheduleResponse(vestingLedgerService.getSchedule(scheduleId)));
    }

    @Override
    public ResponseEntity<ScheduleResponse> getSchedule(Long scheduleId) {
        return ResponseEntity.ok(toScheduleResponse(vestingLedgerService.getSchedule(scheduleId)));
    }

    @Override
    public ResponseEntity<AllocationDTO> createAllocation(Long scheduleId, String caller, CreateAllocationRequest request) {
        int index = vestingLedgerService.createAllocation(scheduleId, caller, request.beneficiary(), request.amount());
        AllocationDTO allocation = SaleMapper.INSTANCE.toDTO(vestingLedgerService.getAllocations(scheduleId).get(index));
        return ResponseEntity.status(HttpStatus.CREATED).body(allocation);
    }

    @Override
    public ResponseEntity<List<AllocationDTO>> getAllocations(Long scheduleId) {
        return ResponseEntity.ok(SaleMapper.INSTANCE.toAllocationDTOList(vestingLedgerService.getAllocations(scheduleId)));
    }

    @Override
    public ResponseEntity<AllocationCountResponse> count(Long scheduleId) {
        return ResponseEntity.ok(new AllocationCountResponse(scheduleId, vestingLedgerService.count(scheduleId)));
    }

    @Override
    public ResponseEntity<AllocationAmountResponse> allocationAmount(Long scheduleId, Integer index) {
        long amount = vestingLedgerService.allocationAmount(scheduleId, index);
        return ResponseEntity.ok(new AllocationAmountResponse(scheduleId, index, amount));
    }

    @Override
    public ResponseEntity<IntervalResponse> advanceInterval(Long scheduleId, String caller) {
        boolean advanced = vestingLedgerService.advanceInterval(scheduleId, caller);
        Integer interval = vestingLedgerService.getSchedule(scheduleId).getCurrentInterval();
        return ResponseEntity.ok(new IntervalResponse(scheduleId, advanced, interval));
    }

    @Override
    public ResponseEntity<ClaimResponse> claim(Long scheduleId, Integer index, String caller) {
        ClaimResult result = vestingLedgerService.claim(scheduleId, caller, index);
        return ResponseEntity.ok(new ClaimResponse(
                scheduleId, index, result.shouldRelease(), result.beneficiary(), result.amount()));
    }

    private ScheduleResponse toScheduleResponse(VestingSchedule schedule) {
        return new ScheduleResponse(
                schedule.getId(),
                schedule.getAdministrator(),
                schedule.getUnlockDate(),
                schedule.getIntervalSeconds(),
                schedule.getNumIntervals(),
                schedule.getCurrentInterval(),
                vestingLedgerService.count(schedule.getId())
        );
    }
}
