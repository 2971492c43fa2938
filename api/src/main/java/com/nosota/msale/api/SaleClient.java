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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.List;

/**
 * WebClient-based implementation of SaleApi for consuming the msale service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class MSaleClientConfig {
 *     @Bean
 *     public WebClient msaleWebClient(WebClient.Builder builder,
 *                                     @Value("${services.msale.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public SaleClient saleClient(WebClient msaleWebClient) {
 *         return new SaleClient(msaleWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class SaleClient implements SaleApi {

    private static final String BASE = "/api/v1/sales";

    private final WebClient webClient;

    @Override
    public ResponseEntity<SaleResponse> createSale(String caller, CreateSaleRequest request) {
        log.debug("Calling createSale: caller={}", caller);

        return webClient.post()
                .uri(BASE)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(SaleResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SaleResponse> getSale(Long saleId) {
        log.debug("Calling getSale: saleId={}", saleId);

        return webClient.get()
                .uri(BASE + "/{saleId}", saleId)
                .retrieve()
                .toEntity(SaleResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SaleResponse> finalizeSale(Long saleId, String caller) {
        log.debug("Calling finalizeSale: saleId={}, caller={}", saleId, caller);

        return webClient.post()
                .uri(BASE + "/{saleId}/finalize", saleId)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(SaleResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AdmissionResponse> checkAdmission(Long saleId, String contributor, Long amount) {
        log.debug("Calling checkAdmission: saleId={}, contributor={}, amount={}", saleId, contributor, amount);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/{saleId}/admission")
                        .queryParam("contributor", contributor)
                        .queryParam("amount", amount)
                        .build(saleId))
                .retrieve()
                .toEntity(AdmissionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ContributionResponse> contribute(Long saleId, String caller, ContributionRequest request) {
        log.debug("Calling contribute: saleId={}, caller={}, amount={}", saleId, caller, request.amount());

        return webClient.post()
                .uri(BASE + "/{saleId}/contributions", saleId)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(ContributionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<IssueResponse> directIssue(Long saleId, String caller, RewardIssueRequest request) {
        log.debug("Calling directIssue: saleId={}, beneficiary={}, rewardAmount={}",
                saleId, request.beneficiary(), request.rewardAmount());

        return webClient.post()
                .uri(BASE + "/{saleId}/direct-issues", saleId)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(IssueResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<IssueResponse> createBonusAllocation(Long saleId, String caller, RewardIssueRequest request) {
        log.debug("Calling createBonusAllocation: saleId={}, beneficiary={}, rewardAmount={}",
                saleId, request.beneficiary(), request.rewardAmount());

        return webClient.post()
                .uri(BASE + "/{saleId}/bonus-allocations", saleId)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(IssueResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReleaseResponse> releaseVestedRewards(Long saleId, String caller) {
        log.debug("Calling releaseVestedRewards: saleId={}", saleId);

        return webClient.post()
                .uri(BASE + "/{saleId}/release", saleId)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(ReleaseResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SaleResponse> setAuthorizationList(Long saleId, String caller, String name) {
        return put(saleId, caller, "/authorization-list", "name", name);
    }

    @Override
    public ResponseEntity<SaleResponse> setVestingSchedule(Long saleId, String caller, Long scheduleId) {
        return put(saleId, caller, "/vesting-schedule", "scheduleId", scheduleId);
    }

    @Override
    public ResponseEntity<SaleResponse> setRewardBook(Long saleId, String caller, String name) {
        return put(saleId, caller, "/reward-book", "name", name);
    }

    @Override
    public ResponseEntity<SaleResponse> setCapacity(Long saleId, String caller, Long value) {
        return put(saleId, caller, "/capacity", "value", value);
    }

    @Override
    public ResponseEntity<SaleResponse> setMaxContribution(Long saleId, String caller, Long value) {
        return put(saleId, caller, "/max-contribution", "value", value);
    }

    @Override
    public ResponseEntity<SaleResponse> setEndTime(Long saleId, String caller, Instant value) {
        return put(saleId, caller, "/end-time", "value", value.toString());
    }

    @Override
    public ResponseEntity<SaleResponse> transferAdministration(Long saleId, String caller, String newAdministrator) {
        log.debug("Calling transferAdministration: saleId={}, newAdministrator={}", saleId, newAdministrator);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/{saleId}/administration/transfer")
                        .queryParam("newAdministrator", newAdministrator)
                        .build(saleId))
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(SaleResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SaleResponse> acceptAdministration(Long saleId, String caller) {
        log.debug("Calling acceptAdministration: saleId={}, caller={}", saleId, caller);

        return webClient.post()
                .uri(BASE + "/{saleId}/administration/accept", saleId)
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(SaleResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<SaleEventDTO>> getSaleEvents(Long saleId) {
        log.debug("Calling getSaleEvents: saleId={}", saleId);

        return webClient.get()
                .uri(BASE + "/{saleId}/events", saleId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<SaleEventDTO>>() {})
                .block();
    }

    private ResponseEntity<SaleResponse> put(Long saleId, String caller, String path, String param, Object value) {
        log.debug("Calling PUT {}{}: saleId={}, {}={}", BASE, path, saleId, param, value);

        return webClient.put()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/{saleId}" + path)
                        .queryParam(param, value)
                        .build(saleId))
                .header(ApiHeaders.ACCOUNT_ID, caller)
                .retrieve()
                .toEntity(SaleResponse.class)
                .block();
    }
}
