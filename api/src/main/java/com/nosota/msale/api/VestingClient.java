package com.nosota.msale.api;

import com.nosota.msale.api.dto.AllocationDTO;
import com.nosota.msale.api.request.CreateAllocationRequest;
import com.nosota.msale.api.request.CreateScheduleRequest;
import com.nosota.msale.api.response.AllocationAmountResponse;
import com.nosota.msale.api.response.AllocationCountResponse;
import com.nosota.msale.api.response.ClaimResponse;
import com.nosota.msale.api.response.IntervalResponse;
import com.nosota.msale.api.response.ScheduleResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of VestingApi. Not a Spring component, see {@link SaleClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class VestingClient implements VestingApi {

    private static final String BASE = "/api/v1/vesting-schedules";

    private final WebClient webClient;

    @Override
    public ResponseEntity<ScheduleResponse> createSchedule(String caller, CreateScheduleRequest request) {
        log.debug("Calling createSchedule: caller={}, numIntervals={}", caller, request.numIntervals());

        return webClient.post()
                .uri(BASE)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(ScheduleResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ScheduleResponse> getSchedule(Long scheduleId) {
        log.debug("Calling getSchedule: scheduleId={}", scheduleId);

        return webClient.get()
                .uri(BASE + "/{scheduleId}", scheduleId)
                .retrieve()
                .toEntity(ScheduleResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AllocationDTO> createAllocation(Long scheduleId, String caller, CreateAllocationRequest request) {
        log.debug("Calling createAllocation: scheduleId={}, beneficiary={}, amount={}",
                scheduleId, request.beneficiary(), request.amount());

        return webClient.post()
                .uri(BASE + "/{scheduleId}/allocations", scheduleId)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(AllocationDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<AllocationDTO>> getAllocations(Long scheduleId) {
        log.debug("Calling getAllocations: scheduleId={}", scheduleId);

        return webClient.get()
                .uri(BASE + "/{scheduleId}/allocations", scheduleId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<AllocationDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<AllocationCountResponse> count(Long scheduleId) {
        return webClient.get()
                .uri(BASE + "/{scheduleId}/allocations/count", scheduleId)
                .retrieve()
                .toEntity(AllocationCountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AllocationAmountResponse> allocationAmount(Long scheduleId, Integer index) {
        return webClient.get()
                .uri(BASE + "/{scheduleId}/allocations/{index}/amount", scheduleId, index)
                .retrieve()
                .toEntity(AllocationAmountResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<IntervalResponse> advanceInterval(Long scheduleId, String caller) {
        log.debug("Calling advanceInterval: scheduleId={}", scheduleId);

        return webClient.post()
                .uri(BASE + "/{scheduleId}/advance", scheduleId)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(IntervalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ClaimResponse> claim(Long scheduleId, Integer index, String caller) {
        log.debug("Calling claim: scheduleId={}, index={}", scheduleId, index);

        return webClient.post()
                .uri(BASE + "/{scheduleId}/allocations/{index}/claim", scheduleId, index)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(ClaimResponse.class)
                .block();
    }
}
