package com.nosota.msale.controller;

import com.nosota.msale.api.SaleApi;
import com.nosota.msale.api.dto.SaleEventDTO;
import com.nosota.msale.api.model.AdmissionFailure;
import com.nosota.msale.api.request.ContributionRequest;
import com.nosota.msale.api.request.CreateSaleRequest;
import com.nosota.msale.api.request.RewardIssueRequest;
import com.nosota.msale.api.response.AdmissionResponse;
import com.nosota.msale.api.response.ContributionResponse;
import com.nosota.msale.api.response.IssueResponse;
import com.nosota.msale.api.response.ReleaseResponse;
import com.nosota.msale.api.response.SaleResponse;
import com.nosota.msale.dto.ContributionReceipt;
import com.nosota.msale.dto.IssueReceipt;
import com.nosota.msale.mapper.SaleMapper;
import com.nosota.msale.model.Sale;
import com.nosota.msale.service.SaleAdministrationService;
import com.nosota.msale.service.SaleService;
import com.nosota.msale.service.VestingLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class SaleController implements SaleApi {

    private final SaleService saleService;
    private final SaleAdministrationService saleAdministrationService;
    private final VestingLedgerService vestingLedgerService;

    @Override
    public ResponseEntity<SaleResponse> createSale(String caller, CreateSaleRequest request) {
        Sale sale = saleAdministrationService.createSale(caller, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toSaleResponse(sale));
    }

    @Override
    public ResponseEntity<SaleResponse> getSale(Long saleId) {
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.getSale(saleId)));
    }

    @Override
    public ResponseEntity<SaleResponse> finalizeSale(Long saleId, String caller) {
        saleService.finalizeSale(saleId, caller);
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.getSale(saleId)));
    }

    @Override
    public ResponseEntity<AdmissionResponse> checkAdmission(Long saleId, String contributor, Long amount) {
        Optional<AdmissionFailure> failure = saleService.admissionCheck(saleId, contributor, amount);
        return ResponseEntity.ok(new AdmissionResponse(saleId, contributor, amount, failure.isEmpty(), failure.orElse(null)));
    }

    @Override
    public ResponseEntity<ContributionResponse> contribute(Long saleId, String caller, ContributionRequest request) {
        ContributionReceipt receipt = saleService.acceptContribution(saleId, caller, request.amount());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ContributionResponse(
                saleId, caller, request.amount(),
                receipt.contributorReward(), receipt.administratorReward(), receipt.totalRaised()));
    }

    @Override
    public ResponseEntity<IssueResponse> directIssue(Long saleId, String caller, RewardIssueRequest request) {
        IssueReceipt receipt = saleService.directIssue(saleId, caller, request.beneficiary(), request.rewardAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(toIssueResponse(saleId, request.beneficiary(), receipt));
    }

    @Override
    public ResponseEntity<IssueResponse> createBonusAllocation(Long saleId, String caller, RewardIssueRequest request) {
        IssueReceipt receipt = saleService.createBonusAllocation(saleId, caller, request.beneficiary(), request.rewardAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(toIssueResponse(saleId, request.beneficiary(), receipt));
    }

    @Override
    public ResponseEntity<ReleaseResponse> releaseVestedRewards(Long saleId, String caller) {
        boolean released = saleService.releaseVestedRewards(saleId, caller);
        Sale sale = saleAdministrationService.getSale(saleId);
        Integer interval = vestingLedgerService.getSchedule(sale.getVestingScheduleId()).getCurrentInterval();
        return ResponseEntity.ok(new ReleaseResponse(saleId, released, interval));
    }

    @Override
    public ResponseEntity<SaleResponse> setAuthorizationList(Long saleId, String caller, String name) {
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.setAuthorizationList(saleId, caller, name)));
    }

    @Override
    public ResponseEntity<SaleResponse> setVestingSchedule(Long saleId, String caller, Long scheduleId) {
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.setVestingSchedule(saleId, caller, scheduleId)));
    }

    @Override
    public ResponseEntity<SaleResponse> setRewardBook(Long saleId, String caller, String name) {
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.setRewardBook(saleId, caller, name)));
    }

    @Override
    public ResponseEntity<SaleResponse> setCapacity(Long saleId, String caller, Long value) {
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.setCapacity(saleId, caller, value)));
    }

    @Override
    public ResponseEntity<SaleResponse> setMaxContribution(Long saleId, String caller, Long value) {
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.setMaxContribution(saleId, caller, value)));
    }

    @Override
    public ResponseEntity<SaleResponse> setEndTime(Long saleId, String caller, Instant value) {
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.setEndTime(saleId, caller, value)));
    }

    @Override
    public ResponseEntity<SaleResponse> transferAdministration(Long saleId, String caller, String newAdministrator) {
        return ResponseEntity.ok(toSaleResponse(
                saleAdministrationService.transferAdministration(saleId, caller, newAdministrator)));
    }

    @Override
    public ResponseEntity<SaleResponse> acceptAdministration(Long saleId, String caller) {
        return ResponseEntity.ok(toSaleResponse(saleAdministrationService.acceptAdministration(saleId, caller)));
    }

    @Override
    public ResponseEntity<List<SaleEventDTO>> getSaleEvents(Long saleId) {
        return ResponseEntity.ok(SaleMapper.INSTANCE.toEventDTOList(saleAdministrationService.getSaleEvents(saleId)));
    }

    private SaleResponse toSaleResponse(Sale sale) {
        return new SaleResponse(
                sale.getId(),
                sale.getAdministrator(),
                sale.getPendingAdministrator(),
                sale.getTreasuryAccount(),
                sale.getWindow().getStartTime(),
                sale.getWindow().getEndTime(),
                sale.getRate(),
                sale.getAdministratorRate(),
                sale.getBonusPercent(),
                sale.getCapacity(),
                sale.getMinContribution(),
                sale.getMaxContribution(),
                sale.getTotalRaised(),
                sale.isFinalized(),
                sale.getFinalizedAt(),
                sale.getVestingScheduleId(),
                sale.getAuthorizationList(),
                sale.getRewardBook(),
                saleAdministrationService.getPhase(sale)
        );
    }

    private IssueResponse toIssueResponse(Long saleId, String beneficiary, IssueReceipt receipt) {
        return new IssueResponse(
                saleId,
                beneficiary,
                receipt.deliveredAmount(),
                receipt.administratorAmount(),
                receipt.vestedAmount(),
                receipt.allocationIndex(),
                receipt.totalRaised()
        );
    }
}
