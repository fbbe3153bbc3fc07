package com.hearthside.controller;

import com.hearthside.model.CallerKey;
import com.hearthside.model.dto.RateLimitStatistics;
import com.hearthside.model.dto.RateWindowSummary;
import com.hearthside.service.RequestOrchestrator;
import com.hearthside.service.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Admin API for inspecting and resetting per-caller rate limits.
 */
@Slf4j
@RestController
@RequestMapping("/api/ai/admin/rate-limits")
public class AdminController {

    private final RateLimiter rateLimiter;
    private final RequestOrchestrator orchestrator;

    public AdminController(RateLimiter rateLimiter, RequestOrchestrator orchestrator) {
        this.rateLimiter = rateLimiter;
        this.orchestrator = orchestrator;
    }

    /**
     * All tracked callers, busiest first.
     */
    @GetMapping
    public ResponseEntity<List<RateWindowSummary>> getWindows() {
        log.info("Admin: Listing rate limit windows");
        return ResponseEntity.ok(rateLimiter.windows());
    }

    @GetMapping("/stats")
    public ResponseEntity<RateLimitStatistics> getStatistics() {
        return ResponseEntity.ok(rateLimiter.statistics());
    }

    @DeleteMapping("/{tenantId}/{callerId}")
    public ResponseEntity<Map<String, String>> resetCaller(@PathVariable String tenantId,
                                                          @PathVariable String callerId) {
        CallerKey callerKey = CallerKey.of(tenantId, callerId);
        log.info("Admin: Resetting rate limits for {}", callerKey);
        orchestrator.resetCallerRateLimit(callerKey);

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Rate limits reset for " + callerKey
        ));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> clearAll() {
        log.warn("Admin: Clearing all rate limit windows");
        rateLimiter.clear();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "All rate limits cleared"
        ));
    }
}
