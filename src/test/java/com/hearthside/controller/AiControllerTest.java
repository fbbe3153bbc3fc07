package com.hearthside.controller;

import com.hearthside.config.ClockConfiguration;
import com.hearthside.config.JacksonConfiguration;
import com.hearthside.model.AiRequest;
import com.hearthside.model.AiResponse;
import com.hearthside.model.AiResult;
import com.hearthside.model.BudgetUsage;
import com.hearthside.model.CallerKey;
import com.hearthside.model.ErrorKind;
import com.hearthside.model.GatewayHeaders;
import com.hearthside.model.RequestCategory;
import com.hearthside.model.ServiceError;
import com.hearthside.model.UsageRecord;
import com.hearthside.service.RequestOrchestrator;
import com.hearthside.service.budget.BudgetTracker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for AiController.
 */
@WebFluxTest(controllers = AiController.class)
@Import({ClockConfiguration.class, JacksonConfiguration.class})
class AiControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private RequestOrchestrator orchestrator;

    @MockBean
    private BudgetTracker budgetTracker;

    private static final Map<String, Object> BODY = Map.of(
            "prompt", "Plan dinners",
            "context", "two kids",
            "requestType", "meal_planning",
            "temperature", 0.0);

    @Test
    void testSuccessfulRequest() {
        when(orchestrator.handle(any())).thenReturn(Mono.just(AiResult.success(AiResponse.builder()
                .content("Soup on Monday")
                .tokenCount(120)
                .cost(new BigDecimal("0.000240"))
                .requestId("ds-1")
                .servedFromCache(false)
                .timestamp(Instant.parse("2024-03-15T10:00:00Z"))
                .build())));

        webTestClient.post().uri("/api/ai/request")
                .header(GatewayHeaders.CALLER_ID, "alice")
                .header(GatewayHeaders.TENANT_ID, "family-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(GatewayHeaders.CACHE_HIT, "false")
                .expectHeader().valueEquals(GatewayHeaders.REQUEST_ID, "ds-1")
                .expectBody()
                .jsonPath("$.content").isEqualTo("Soup on Monday")
                .jsonPath("$.tokenCount").isEqualTo(120)
                .jsonPath("$.servedFromCache").isEqualTo(false)
                .jsonPath("$.timestamp").isEqualTo("2024-03-15T10:00:00Z");

        ArgumentCaptor<AiRequest> captor = ArgumentCaptor.forClass(AiRequest.class);
        verify(orchestrator).handle(captor.capture());
        AiRequest request = captor.getValue();
        assertEquals("alice", request.getCallerId());
        assertEquals("family-1", request.getTenantId());
        assertEquals(RequestCategory.MEAL_PLANNING, request.getCategory());
        assertEquals("two kids", request.getContext());
        assertEquals(0.0, request.getTemperature());
        assertNull(request.getMaxTokens());
    }

    @ParameterizedTest
    @CsvSource({
            "BUDGET_EXCEEDED, BUDGET_EXCEEDED, 402, budget_exceeded",
            "RATE_LIMIT_EXCEEDED, RATE_LIMIT, 429, rate_limit",
            "INVALID_REQUEST, VALIDATION_ERROR, 400, validation_error",
            "NETWORK_ERROR, NETWORK_ERROR, 502, network_error",
            "API_SERVER_ERROR, API_ERROR, 500, api_error"
    })
    void testFailureStatusMapping(String code, ErrorKind kind, int status, String wireKind) {
        when(orchestrator.handle(any())).thenReturn(Mono.just(AiResult.failure(
                ServiceError.of(code, "failed", kind, true))));

        webTestClient.post().uri("/api/ai/request")
                .header(GatewayHeaders.CALLER_ID, "alice")
                .header(GatewayHeaders.TENANT_ID, "family-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isEqualTo(status)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.errorCode").isEqualTo(code)
                .jsonPath("$.errorType").isEqualTo(wireKind)
                .jsonPath("$.retryable").isEqualTo(true)
                .jsonPath("$.path").isEqualTo("/api/ai/request")
                .jsonPath("$.timestamp").exists();
    }

    @Test
    void testUnknownRequestTypeRejectedWithoutPipeline() {
        webTestClient.post().uri("/api/ai/request")
                .header(GatewayHeaders.CALLER_ID, "alice")
                .header(GatewayHeaders.TENANT_ID, "family-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("prompt", "hi", "requestType", "horoscope"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo(ServiceError.INVALID_REQUEST);

        verify(orchestrator, never()).handle(any());
    }

    @Test
    void testBudgetUsage() {
        when(orchestrator.budgetUsage(CallerKey.of("family-1", "alice"))).thenReturn(BudgetUsage.builder()
                .dailyUsed(new BigDecimal("1.5"))
                .monthlyUsed(new BigDecimal("20"))
                .dailyRemaining(new BigDecimal("8.5"))
                .monthlyRemaining(new BigDecimal("180"))
                .tokensUsed(10000)
                .requestCount(12)
                .averageCost(new BigDecimal("1.666667"))
                .build());

        webTestClient.get().uri("/api/ai/budget/usage")
                .header(GatewayHeaders.CALLER_ID, "alice")
                .header(GatewayHeaders.TENANT_ID, "family-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.requestCount").isEqualTo(12)
                .jsonPath("$.dailyRemaining").isEqualTo(8.5);
    }

    @Test
    void testMissingIdentityHeaderIsBadRequest() {
        webTestClient.get().uri("/api/ai/budget/usage")
                .header(GatewayHeaders.TENANT_ID, "family-1")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.errorCode").isEqualTo(ServiceError.INVALID_REQUEST)
                .jsonPath("$.path").isEqualTo("/api/ai/budget/usage");
    }

    @Test
    void testBudgetRecordsPassesFilters() {
        when(budgetTracker.records(eq("family-1"), any(), any(), eq(5))).thenReturn(List.of(UsageRecord.builder()
                .id("u1")
                .callerId("alice")
                .tenantId("family-1")
                .category(RequestCategory.SHOPPING_LIST)
                .tokens(10)
                .cost(new BigDecimal("0.000020"))
                .requestId("r1")
                .timestamp(Instant.parse("2024-03-10T08:00:00Z"))
                .build()));

        webTestClient.get().uri("/api/ai/budget/records?startDate=2024-03-01&endDate=2024-03-15&limit=5")
                .header(GatewayHeaders.TENANT_ID, "family-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].requestId").isEqualTo("r1")
                .jsonPath("$[0].category").isEqualTo("shopping_list");

        verify(budgetTracker).records("family-1", LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15), 5);
    }
}
