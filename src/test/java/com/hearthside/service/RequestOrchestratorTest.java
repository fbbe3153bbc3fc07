package com.hearthside.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hearthside.config.HearthsideProperties;
import com.hearthside.config.JacksonConfiguration;
import com.hearthside.model.AiRequest;
import com.hearthside.model.AiResponse;
import com.hearthside.model.AiResult;
import com.hearthside.model.CallerKey;
import com.hearthside.model.ChatMessage;
import com.hearthside.model.ErrorKind;
import com.hearthside.model.ServiceError;
import com.hearthside.model.dto.ServiceStatus;
import com.hearthside.provider.ProviderException;
import com.hearthside.service.budget.BudgetTracker;
import com.hearthside.service.budget.CostModel;
import com.hearthside.service.cache.RequestFingerprinter;
import com.hearthside.service.cache.ResponseCache;
import com.hearthside.service.concurrency.CallerLocks;
import com.hearthside.service.concurrency.InFlightRequests;
import com.hearthside.service.ratelimit.RateLimiter;
import com.hearthside.support.FakeModelClient;
import com.hearthside.support.MutableClock;
import com.hearthside.support.TestRequests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for RequestOrchestrator wired to real policy components and a scripted model client.
 */
class RequestOrchestratorTest {

    private static final Instant START = Instant.parse("2024-03-15T10:00:00Z");
    private static final CallerKey U1 = CallerKey.of(TestRequests.TENANT, TestRequests.CALLER);

    private MutableClock clock;
    private HearthsideProperties properties;
    private RateLimiter rateLimiter;
    private ResponseCache cache;
    private BudgetTracker budgetTracker;
    private CostModel costModel;
    private FakeModelClient modelClient;
    private RequestOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = TestRequests.properties();
        modelClient = new FakeModelClient();
        rebuild();
    }

    private void rebuild() {
        ObjectMapper objectMapper = JacksonConfiguration.configure(new ObjectMapper());
        rateLimiter = new RateLimiter(properties, clock);
        cache = new ResponseCache(new RequestFingerprinter(properties, objectMapper), properties, clock);
        costModel = new CostModel(properties);
        budgetTracker = new BudgetTracker(costModel, properties, clock);
        orchestrator = new RequestOrchestrator(properties, new RequestValidator(), rateLimiter, cache,
                budgetTracker, costModel, modelClient, new ProviderErrorClassifier(), new CallerLocks(), new InFlightRequests(), clock);
    }

    @Test
    void testSuccessfulCallIsDebitedCachedAndCounted() {
        modelClient.respondWith("Soup on Monday", 250, "ds-1");

        AiResult result = orchestrator.process(TestRequests.request("Plan dinners").build());

        assertTrue(result.isSuccess());
        AiResponse response = result.getResponse();
        assertEquals("Soup on Monday", response.getContent());
        assertEquals(250, response.getTokenCount());
        assertEquals(new BigDecimal("0.000500"), response.getCost());
        assertEquals("ds-1", response.getRequestId());
        assertFalse(response.isServedFromCache());
        assertEquals(START, response.getTimestamp());

        assertEquals(1, modelClient.calls());
        assertEquals(1, cache.size());
        assertEquals(1, rateLimiter.status(U1).getDay().getUsed());
        assertEquals(250, budgetTracker.usage(U1).getTokensUsed());
        assertEquals(1, budgetTracker.recordCount());
    }

    @Test
    void testRepeatedPromptIsServedFromCacheAndStillCounted() {
        AiRequest request = TestRequests.request("Plan dinners").build();

        AiResult first = orchestrator.process(request);
        clock.advance(Duration.ofSeconds(5));
        AiResult second = orchestrator.process(request);

        assertFalse(first.getResponse().isServedFromCache());
        assertTrue(second.getResponse().isServedFromCache());
        assertEquals(first.getResponse().getContent(), second.getResponse().getContent());
        assertEquals(0, BigDecimal.ZERO.compareTo(second.getResponse().getCost()));
        assertEquals(START, second.getResponse().getTimestamp());

        String fingerprint = cache.fingerprint(request).getValue();
        assertEquals("cached_" + fingerprint.substring(0, 8), second.getResponse().getRequestId());

        assertEquals(1, modelClient.calls());
        assertEquals(2, rateLimiter.status(U1).getMinute().getUsed());
        assertEquals(1, budgetTracker.usage(U1).getRequestCount());
    }

    @Test
    void testExhaustedDailyBudgetRejectsWithoutCounting() {
        // 100 tokens cost exactly the daily ceiling
        properties.getBudget().setDailyLimit(new BigDecimal("0.0002"));
        rebuild();
        modelClient.respondWith("Soup", 100, "ds-1");

        assertTrue(orchestrator.process(TestRequests.request("Plan dinners").build()).isSuccess());
        assertEquals(0, budgetTracker.usage(U1).getDailyRemaining().signum());

        AiResult rejected = orchestrator.process(TestRequests.request("Plan lunches").build());

        assertFalse(rejected.isSuccess());
        ServiceError error = rejected.getError();
        assertEquals(ServiceError.BUDGET_EXCEEDED, error.getCode());
        assertEquals(ErrorKind.BUDGET_EXCEEDED, error.getKind());
        assertFalse(error.isRetryable());

        assertEquals(1, modelClient.calls());
        assertEquals(1, rateLimiter.status(U1).getDay().getUsed());
    }

    @Test
    void testCacheHitIsServedEvenWhenBudgetIsExhausted() {
        properties.getBudget().setDailyLimit(new BigDecimal("0.0002"));
        rebuild();
        modelClient.respondWith("Soup", 100, "ds-1");
        AiRequest request = TestRequests.request("Plan dinners").build();

        orchestrator.process(request);
        AiResult again = orchestrator.process(request);

        assertTrue(again.isSuccess());
        assertTrue(again.getResponse().isServedFromCache());
        assertEquals(1, budgetTracker.recordCount());
    }

    @Test
    void testRateLimitRejectsBeforeCache() {
        properties.getRateLimit().setRequestsPerMinute(2);
        rebuild();
        AiRequest request = TestRequests.request("Plan dinners").build();

        orchestrator.process(request);
        orchestrator.process(request);
        AiResult third = orchestrator.process(request);

        assertFalse(third.isSuccess());
        assertEquals(ServiceError.RATE_LIMIT_EXCEEDED, third.getError().getCode());
        assertEquals(ErrorKind.RATE_LIMIT, third.getError().getKind());
        assertTrue(third.getError().isRetryable());
        assertEquals("per-minute", third.getError().getDetails().get("tier"));

        assertEquals(2, rateLimiter.status(U1).getMinute().getUsed());
        assertEquals(1, cache.stats().getTotalHits());
    }

    @Test
    void testDisabledFeatureTouchesNothing() {
        properties.setEnabled(false);

        AiResult result = orchestrator.process(TestRequests.request("Plan dinners").build());

        assertEquals(ServiceError.AI_DISABLED, result.getError().getCode());
        assertEquals(ErrorKind.VALIDATION_ERROR, result.getError().getKind());
        assertEquals(0, modelClient.calls());
        assertEquals(0, rateLimiter.trackedCallers());
    }

    @Test
    void testMissingApiKeyDisablesFeature() {
        properties.getModel().setApiKey(" ");

        assertEquals(ServiceError.AI_DISABLED,
                orchestrator.process(TestRequests.request("Plan dinners").build()).getError().getCode());
    }

    @Test
    void testInvalidRequestTouchesNothing() {
        AiResult result = orchestrator.process(TestRequests.request("Plan dinners").maxTokens(5000).build());

        assertEquals(ServiceError.INVALID_REQUEST, result.getError().getCode());
        assertFalse(result.getError().isRetryable());
        assertEquals(0, rateLimiter.trackedCallers());
        assertEquals(0, modelClient.calls());
    }

    @Test
    void testProviderFailureLeavesNoTrace() {
        modelClient.failWith(ProviderException.status(503, "unavailable", null));

        AiResult result = orchestrator.process(TestRequests.request("Plan dinners").build());

        assertEquals(ServiceError.API_SERVER_ERROR, result.getError().getCode());
        assertTrue(result.getError().isRetryable());
        assertEquals(0, cache.size());
        assertEquals(0, budgetTracker.recordCount());
        assertEquals(0, rateLimiter.status(U1).getDay().getUsed());
    }

    @Test
    void testProviderTimeoutIsNetworkError() {
        modelClient.failWith(ProviderException.timeout("slow", null));

        AiResult result = orchestrator.process(TestRequests.request("Plan dinners").build());

        assertEquals(ErrorKind.NETWORK_ERROR, result.getError().getKind());
    }

    @Test
    void testMessagesCarrySystemPromptContextAndPrompt() {
        orchestrator.process(TestRequests.request("Plan dinners").context("two kids, no nuts").build());

        List<ChatMessage> messages = modelClient.lastConversation();
        assertEquals(3, messages.size());
        assertEquals(ChatMessage.ROLE_SYSTEM, messages.get(0).getRole());
        assertEquals("Context: two kids, no nuts", messages.get(1).getContent());
        assertEquals(ChatMessage.ROLE_USER, messages.get(2).getRole());
        assertEquals("Plan dinners", messages.get(2).getContent());
    }

    @Test
    void testNoContextTurnWithoutContext() {
        orchestrator.process(TestRequests.request("Plan dinners").build());

        assertEquals(2, modelClient.lastConversation().size());
    }

    @Test
    void testMissingProviderIdAndUsageAreFilledIn() {
        modelClient.respondWith("Soup", 0, null);

        AiResponse response = orchestrator.process(TestRequests.request("Plan dinners").build()).getResponse();

        assertTrue(response.getRequestId().startsWith("ai_"));
        assertEquals(costModel.estimateTokens("Plan dinners", null), response.getTokenCount());
    }

    @Test
    void testUnexpectedFaultBecomesUnknownError() {
        RateLimiter broken = mock(RateLimiter.class);
        when(broken.check(any(), anyInt())).thenThrow(new IllegalStateException("boom"));
        orchestrator = new RequestOrchestrator(properties, new RequestValidator(), broken, cache,
                budgetTracker, costModel, modelClient, new ProviderErrorClassifier(), new CallerLocks(), new InFlightRequests(), clock);

        AiResult result = orchestrator.process(TestRequests.request("Plan dinners").build());

        assertEquals(ServiceError.UNKNOWN_ERROR, result.getError().getCode());
        assertEquals(ErrorKind.API_ERROR, result.getError().getKind());
        assertTrue(result.getError().isRetryable());
    }

    @Test
    void testHandleEmitsResultNeverError() {
        modelClient.failWith(ProviderException.status(401, "bad key", null));

        StepVerifier.create(orchestrator.handle(TestRequests.request("Plan dinners").build()))
                .assertNext(result -> {
                    assertFalse(result.isSuccess());
                    assertEquals(ServiceError.API_AUTH_ERROR, result.getError().getCode());
                    assertFalse(result.getError().isRetryable());
                })
                .verifyComplete();
    }

    @Test
    void testServiceStatus() {
        orchestrator.process(TestRequests.request("Plan dinners").build());

        ServiceStatus status = orchestrator.serviceStatus(U1);

        assertTrue(status.isEnabled());
        assertEquals(1, status.getRateLimitStatus().getDay().getUsed());
        assertEquals(1, status.getCacheStats().getSize());
        assertEquals(1, status.getBudgetUsage().getRequestCount());

        properties.setEnabled(false);
        ServiceStatus disabled = orchestrator.serviceStatus(U1);
        assertFalse(disabled.isEnabled());
        assertNull(disabled.getBudgetUsage());
    }

    @Test
    void testAdminOperations() {
        orchestrator.process(TestRequests.request("Plan dinners").build());

        assertEquals(1, orchestrator.cacheEntries(10).size());
        orchestrator.clearCache();
        assertEquals(0, orchestrator.cacheStatistics().getSize());

        orchestrator.resetCallerRateLimit(U1);
        assertEquals(0, orchestrator.rateLimitStatus(U1).getDay().getUsed());
        assertEquals(1, orchestrator.budgetUsage(U1).getRequestCount());
    }
}
