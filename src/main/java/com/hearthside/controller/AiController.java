package com.hearthside.controller;

import com.hearthside.model.AiRequest;
import com.hearthside.model.AiResult;
import com.hearthside.model.BudgetUsage;
import com.hearthside.model.CallerKey;
import com.hearthside.model.ErrorKind;
import com.hearthside.model.GatewayHeaders;
import com.hearthside.model.RateLimitStatus;
import com.hearthside.model.RequestCategory;
import com.hearthside.model.ServiceError;
import com.hearthside.model.UsageRecord;
import com.hearthside.model.dto.AiRequestBody;
import com.hearthside.model.dto.ErrorResponse;
import com.hearthside.model.dto.ServiceStatus;
import com.hearthside.model.dto.TenantBudgetStatistics;
import com.hearthside.service.RequestOrchestrator;
import com.hearthside.service.budget.BudgetTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Client-facing AI endpoints. Caller identity is taken from headers set by the
 * authenticating front end.
 */
@Slf4j
@RestController
@RequestMapping("/api/ai")
public class AiController {

    private final RequestOrchestrator orchestrator;
    private final BudgetTracker budgetTracker;
    private final Clock clock;

    public AiController(RequestOrchestrator orchestrator, BudgetTracker budgetTracker, Clock clock) {
        this.orchestrator = orchestrator;
        this.budgetTracker = budgetTracker;
        this.clock = clock;
    }

    /**
     * Generate text through the gating pipeline.
     * Adds {@code x-cache-hit} and {@code x-request-id} headers on success.
     */
    @PostMapping(value = "/request", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<?>> request(
            @RequestBody AiRequestBody body,
            @RequestHeader(value = GatewayHeaders.CALLER_ID, required = false) String callerId,
            @RequestHeader(value = GatewayHeaders.TENANT_ID, required = false) String tenantId,
            ServerHttpRequest httpRequest) {

        String path = httpRequest.getPath().value();
        log.debug("Received AI request: caller={}:{}, type={}", tenantId, callerId, body.getRequestType());

        RequestCategory category;
        try {
            category = RequestCategory.fromValue(body.getRequestType());
        } catch (IllegalArgumentException e) {
            return Mono.just(toErrorEntity(ServiceError.invalidRequest(e.getMessage()), path));
        }

        AiRequest request = AiRequest.builder()
                .prompt(body.getPrompt())
                .context(body.getContext())
                .category(category)
                .maxTokens(body.getMaxTokens())
                .temperature(body.getTemperature())
                .callerId(callerId)
                .tenantId(tenantId)
                .build();

        return orchestrator.handle(request)
                .map(result -> toEntity(result, path));
    }

    @GetMapping("/budget/usage")
    public ResponseEntity<BudgetUsage> budgetUsage(
            @RequestHeader(GatewayHeaders.CALLER_ID) String callerId,
            @RequestHeader(GatewayHeaders.TENANT_ID) String tenantId) {
        return ResponseEntity.ok(orchestrator.budgetUsage(CallerKey.of(tenantId, callerId)));
    }

    /**
     * Usage records of the caller's family, newest first.
     */
    @GetMapping("/budget/records")
    public ResponseEntity<List<UsageRecord>> budgetRecords(
            @RequestHeader(GatewayHeaders.TENANT_ID) String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(budgetTracker.records(tenantId, startDate, endDate, limit));
    }

    @GetMapping("/budget/stats")
    public ResponseEntity<TenantBudgetStatistics> budgetStats(
            @RequestHeader(GatewayHeaders.TENANT_ID) String tenantId) {
        return ResponseEntity.ok(budgetTracker.tenantStatistics(tenantId));
    }

    @GetMapping("/rate-limit/status")
    public ResponseEntity<RateLimitStatus> rateLimitStatus(
            @RequestHeader(GatewayHeaders.CALLER_ID) String callerId,
            @RequestHeader(GatewayHeaders.TENANT_ID) String tenantId) {
        return ResponseEntity.ok(orchestrator.rateLimitStatus(CallerKey.of(tenantId, callerId)));
    }

    @GetMapping("/status")
    public ResponseEntity<ServiceStatus> status(
            @RequestHeader(GatewayHeaders.CALLER_ID) String callerId,
            @RequestHeader(GatewayHeaders.TENANT_ID) String tenantId) {
        return ResponseEntity.ok(orchestrator.serviceStatus(CallerKey.of(tenantId, callerId)));
    }

    private ResponseEntity<?> toEntity(AiResult result, String path) {
        if (!result.isSuccess()) {
            return toErrorEntity(result.getError(), path);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.add(GatewayHeaders.CACHE_HIT, String.valueOf(result.getResponse().isServedFromCache()));
        headers.add(GatewayHeaders.REQUEST_ID, result.getResponse().getRequestId());

        return ResponseEntity.ok()
                .headers(headers)
                .body(result.getResponse());
    }

    private ResponseEntity<?> toErrorEntity(ServiceError error, String path) {
        return ResponseEntity.status(statusFor(error.getKind()))
                .body(ErrorResponse.from(error, path, clock.instant()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case BUDGET_EXCEEDED:
                return HttpStatus.PAYMENT_REQUIRED;
            case RATE_LIMIT:
                return HttpStatus.TOO_MANY_REQUESTS;
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            case NETWORK_ERROR:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
