package com.nosota.msale.api;

import com.nosota.msale.api.dto.SaleEventDTO;
import com.nosota.msale.api.request.ContributionRequest;
import com.nosota.msale.api.request.CreateSaleRequest;
import com.nosota.msale.api.request.RewardIssueRequest;
import com.nosota.msale.api.response.AdmissionResponse;
import com.nosota.msale.api.response.ContributionResponse;
import com.nosota.msale.api.response.IssueResponse;
import com.nosota.msale.api.response.ReleaseResponse;
import com.nosota.msale.api.response.SaleResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Sale API interface.
 *
 * <p>Defines REST endpoints of the sale controller:
 * <ul>
 *   <li>Sale creation and state queries</li>
 *   <li>Contributions (admission checked) and administrator issues (direct, bonus)</li>
 *   <li>Vested reward release and finalization</li>
 *   <li>Administrative setters and two-step administration transfer</li>
 * </ul>
 *
 * <p>The calling account is passed in the {@value ApiHeaders#ACCOUNT_ID} header.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>SaleController - in service module (server-side implementation)</li>
 *   <li>SaleClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/sales")
public interface SaleApi {

    // ==================== Lifecycle ====================

    /**
     * Creates a sale and its vesting schedule. The caller becomes the administrator.
     *
     * @param caller  Calling account
     * @param request Sale parameters
     * @return Created sale
     */
    @PostMapping
    ResponseEntity<SaleResponse> createSale(
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestBody @Valid CreateSaleRequest request);

    /**
     * Gets a sale with its current phase.
     *
     * @param saleId Sale ID
     * @return Sale state
     */
    @GetMapping("/{saleId}")
    ResponseEntity<SaleResponse> getSale(@PathVariable("saleId") Long saleId);

    /**
     * Finalizes an ended sale: freezes issuance and pays out the first vesting interval.
     *
     * @param saleId Sale ID
     * @param caller Administrator account
     * @return Finalized sale
     */
    @PostMapping("/{saleId}/finalize")
    ResponseEntity<SaleResponse> finalizeSale(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller);

    // ==================== Issuance ====================

    /**
     * Evaluates the admission check for a prospective contribution without contributing.
     *
     * @param saleId      Sale ID
     * @param contributor Prospective contributor
     * @param amount      Prospective amount
     * @return Whether it would be admitted, and the first failed condition otherwise
     */
    @GetMapping("/{saleId}/admission")
    ResponseEntity<AdmissionResponse> checkAdmission(
            @PathVariable("saleId") Long saleId,
            @RequestParam("contributor") @NotBlank String contributor,
            @RequestParam("amount") @Positive Long amount);

    /**
     * Contributes to a sale on behalf of the calling account.
     *
     * @param saleId  Sale ID
     * @param caller  Contributing account
     * @param request Contribution amount
     * @return Issued rewards and new total raised
     */
    @PostMapping("/{saleId}/contributions")
    ResponseEntity<ContributionResponse> contribute(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestBody @Valid ContributionRequest request);

    /**
     * Issues reward units for a contribution vetted outside the sale. Bypasses the admission check.
     *
     * @param saleId  Sale ID
     * @param caller  Administrator account
     * @param request Beneficiary and reward amount
     * @return Issued amounts
     */
    @PostMapping("/{saleId}/direct-issues")
    ResponseEntity<IssueResponse> directIssue(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestBody @Valid RewardIssueRequest request);

    /**
     * Issues reward units of which the bonus share is vested through the sale's vesting schedule.
     *
     * @param saleId  Sale ID
     * @param caller  Administrator account
     * @param request Beneficiary and reward amount
     * @return Delivered, vested and administrator amounts
     */
    @PostMapping("/{saleId}/bonus-allocations")
    ResponseEntity<IssueResponse> createBonusAllocation(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestBody @Valid RewardIssueRequest request);

    /**
     * Advances the vesting interval and releases what is due to every beneficiary.
     *
     * @param saleId Sale ID
     * @param caller Administrator account
     * @return Whether an interval was released
     */
    @PostMapping("/{saleId}/release")
    ResponseEntity<ReleaseResponse> releaseVestedRewards(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller);

    // ==================== Administration ====================

    @PutMapping("/{saleId}/authorization-list")
    ResponseEntity<SaleResponse> setAuthorizationList(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestParam("name") @NotBlank String name);

    @PutMapping("/{saleId}/vesting-schedule")
    ResponseEntity<SaleResponse> setVestingSchedule(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestParam("scheduleId") @NotNull Long scheduleId);

    @PutMapping("/{saleId}/reward-book")
    ResponseEntity<SaleResponse> setRewardBook(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestParam("name") @NotBlank String name);

    @PutMapping("/{saleId}/capacity")
    ResponseEntity<SaleResponse> setCapacity(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestParam("value") @Positive Long value);

    @PutMapping("/{saleId}/max-contribution")
    ResponseEntity<SaleResponse> setMaxContribution(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestParam("value") @PositiveOrZero Long value);

    @PutMapping("/{saleId}/end-time")
    ResponseEntity<SaleResponse> setEndTime(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestParam("value") @NotNull Instant value);

    /**
     * Starts a two-step administration transfer. The new administrator has to accept it.
     */
    @PostMapping("/{saleId}/administration/transfer")
    ResponseEntity<SaleResponse> transferAdministration(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller,
            @RequestParam("newAdministrator") @NotBlank String newAdministrator);

    /**
     * Completes a pending administration transfer. Must be called by the pending administrator.
     */
    @PostMapping("/{saleId}/administration/accept")
    ResponseEntity<SaleResponse> acceptAdministration(
            @PathVariable("saleId") Long saleId,
            @RequestHeader(ApiHeaders.ACCOUNT_ID) @NotBlank String caller);

    // ==================== Query Operations ====================

    /**
     * Gets the audit trail of a sale, oldest first.
     *
     * @param saleId Sale ID
     * @return Sale events
     */
    @GetMapping("/{saleId}/events")
    ResponseEntity<List<SaleEventDTO>> getSaleEvents(@PathVariable("saleId") Long saleId);
}
