package com.nosota.msale.tests;

import com.nosota.msale.TestBase;
import com.nosota.msale.api.ApiHeaders;
import com.nosota.msale.api.dto.SaleEventDTO;
import com.nosota.msale.api.model.SaleEventType;
import com.nosota.msale.api.request.ContributionRequest;
import com.nosota.msale.api.request.CreateAllocationRequest;
import com.nosota.msale.api.request.CreateScheduleRequest;
import com.nosota.msale.api.response.SaleResponse;
import com.nosota.msale.api.response.ScheduleResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST tests through MockMvc: request mapping, validation and the error mapping of
 * {@link com.nosota.msale.exception.GlobalExceptionHandler}.
 */
@DisplayName("10. Sale API Tests")
public class SaleApiTest extends TestBase {

    private String admin;
    private String alice;
    private String list;
    private String book;

    @BeforeEach
    void setUpCollaborators() throws Exception {
        admin = unique("admin");
        alice = unique("alice");
        list = unique("list");
        book = unique("book");

        mockMvc.perform(post("/api/v1/authorization-lists")
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .param("name", list))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.owner").value(admin));

        mockMvc.perform(put("/api/v1/authorization-lists/{name}/accounts/{account}", list, alice)
                        .header(ApiHeaders.ACCOUNT_ID, admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authorized").value(true));

        mockMvc.perform(post("/api/v1/reward-books").param("name", book))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.issuanceFrozen").value(false));
    }

    private SaleResponse createSale() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/sales")
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(saleRequest(list, book))))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), SaleResponse.class);
    }

    @Test
    @DisplayName("API-001: create a sale and contribute to it")
    void createAndContribute() throws Exception {
        // Arrange
        SaleResponse sale = createSale();
        assertThat(sale.phase().name()).isEqualTo("NOT_STARTED");
        assertThat(sale.treasuryAccount()).isEqualTo("sale:" + sale.saleId());

        mockMvc.perform(get("/api/v1/sales/{saleId}/admission", sale.saleId())
                        .param("contributor", alice)
                        .param("amount", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.admitted").value(false))
                .andExpect(jsonPath("$.reason").value("WINDOW_CLOSED"));

        clock.setInstant(sale.startTime().plusSeconds(1));

        // Act
        mockMvc.perform(post("/api/v1/sales/{saleId}/contributions", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ContributionRequest(10L))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.contributorReward").value(50))
                .andExpect(jsonPath("$.administratorReward").value(10))
                .andExpect(jsonPath("$.totalRaised").value(10));

        // Assert
        mockMvc.perform(get("/api/v1/sales/{saleId}", sale.saleId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("OPEN"))
                .andExpect(jsonPath("$.totalRaised").value(10));

        mockMvc.perform(get("/api/v1/reward-books/{name}/balances/{account}", book, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(50));

        MvcResult eventsResult = mockMvc.perform(get("/api/v1/sales/{saleId}/events", sale.saleId()))
                .andExpect(status().isOk())
                .andReturn();
        List<SaleEventDTO> events = objectMapper.readValue(
                eventsResult.getResponse().getContentAsString(),
                objectMapper.getTypeFactory().constructCollectionType(List.class, SaleEventDTO.class));
        assertThat(events).extracting(SaleEventDTO::type)
                .containsExactly(SaleEventType.SALE_CREATED, SaleEventType.CONTRIBUTION_ACCEPTED);
    }

    @Test
    @DisplayName("API-002: rejected contributions answer 422 with the failed condition")
    void rejectedContribution() throws Exception {
        SaleResponse sale = createSale();
        clock.setInstant(sale.startTime().plusSeconds(1));

        mockMvc.perform(post("/api/v1/sales/{saleId}/contributions", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, unique("mallory"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ContributionRequest(10L))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Contribution Rejected: NOT_AUTHORIZED"));
    }

    @Test
    @DisplayName("API-003: request validation answers 400")
    void validation() throws Exception {
        SaleResponse sale = createSale();

        mockMvc.perform(post("/api/v1/sales/{saleId}/contributions", sale.saleId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ContributionRequest(10L))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/v1/sales/{saleId}/contributions", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ContributionRequest(0L))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(put("/api/v1/sales/{saleId}/capacity", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .param("value", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("API-004: capability and state errors map to 403 and 409, unknown sales to 404")
    void errorMapping() throws Exception {
        SaleResponse sale = createSale();

        mockMvc.perform(post("/api/v1/sales/{saleId}/finalize", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, alice))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/sales/{saleId}/finalize", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, admin))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Sale Not Ended"));

        mockMvc.perform(get("/api/v1/sales/{saleId}", Long.MAX_VALUE))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/v1/sales")
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(saleRequest(list, book))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Reward Book Unavailable"));

        clock.setInstant(sale.startTime());
        mockMvc.perform(put("/api/v1/sales/{saleId}/reward-book", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .param("name", book))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("API-005: setters and administration transfer")
    void administration() throws Exception {
        SaleResponse sale = createSale();
        Instant newEnd = sale.endTime().plus(Duration.ofDays(2));

        mockMvc.perform(put("/api/v1/sales/{saleId}/end-time", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .param("value", newEnd.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endTime").value(newEnd.toString()));

        mockMvc.perform(post("/api/v1/sales/{saleId}/administration/transfer", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .param("newAdministrator", alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pendingAdministrator").value(alice));

        mockMvc.perform(post("/api/v1/sales/{saleId}/administration/accept", sale.saleId())
                        .header(ApiHeaders.ACCOUNT_ID, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.administrator").value(alice));
    }

    @Test
    @DisplayName("API-006: vesting schedules operated over REST")
    void vestingSchedule() throws Exception {
        Instant unlock = clock.instant().plus(Duration.ofDays(1));
        MvcResult created = mockMvc.perform(post("/api/v1/vesting-schedules")
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CreateScheduleRequest(null, unlock, 86400L, 4))))
                .andExpect(status().isCreated())
                .andReturn();
        ScheduleResponse schedule = objectMapper.readValue(created.getResponse().getContentAsString(), ScheduleResponse.class);
        assertThat(schedule.administrator()).isEqualTo(admin);

        mockMvc.perform(post("/api/v1/vesting-schedules/{id}/allocations", schedule.scheduleId())
                        .header(ApiHeaders.ACCOUNT_ID, admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateAllocationRequest(alice, 1000L))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.index").value(0))
                .andExpect(jsonPath("$.remainingBalance").value(1000));

        mockMvc.perform(get("/api/v1/vesting-schedules/{id}/allocations/count", schedule.scheduleId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));

        mockMvc.perform(get("/api/v1/vesting-schedules/{id}/allocations/{index}/amount", schedule.scheduleId(), 5))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Index Out Of Range"));

        mockMvc.perform(post("/api/v1/vesting-schedules/{id}/advance", schedule.scheduleId())
                        .header(ApiHeaders.ACCOUNT_ID, admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.advanced").value(false));

        clock.setInstant(unlock.plusSeconds(1));
        mockMvc.perform(post("/api/v1/vesting-schedules/{id}/advance", schedule.scheduleId())
                        .header(ApiHeaders.ACCOUNT_ID, admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.advanced").value(true))
                .andExpect(jsonPath("$.currentInterval").value(1));

        mockMvc.perform(post("/api/v1/vesting-schedules/{id}/allocations/{index}/claim", schedule.scheduleId(), 0)
                        .header(ApiHeaders.ACCOUNT_ID, admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shouldRelease").value(true))
                .andExpect(jsonPath("$.amount").value(250));

        mockMvc.perform(post("/api/v1/vesting-schedules/{id}/allocations/{index}/claim", schedule.scheduleId(), 0)
                        .header(ApiHeaders.ACCOUNT_ID, admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shouldRelease").value(false));
    }

    @Test
    @DisplayName("API-007: responses carry a correlation ID")
    void correlationId() throws Exception {
        mockMvc.perform(get("/api/v1/reward-books/{name}", book)
                        .header(ApiHeaders.CORRELATION_ID, "test-correlation"))
                .andExpect(status().isOk())
                .andExpect(header().string(ApiHeaders.CORRELATION_ID, "test-correlation"));
    }

    @Test
    @DisplayName("API-008: only the API is served outside the dev profile")
    void apiDocsHidden() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/internal/anything"))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/reward-books/{name}", book))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("Set-Cookie"));
    }
}
