package com.hearthside.controller;

import com.hearthside.model.dto.CacheEntrySummary;
import com.hearthside.model.dto.CacheStatistics;
import com.hearthside.service.RequestOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Response cache statistics and management.
 */
@Slf4j
@RestController
@RequestMapping("/api/ai/cache")
public class CacheController {

    private final RequestOrchestrator orchestrator;

    public CacheController(RequestOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(orchestrator.cacheStatistics());
    }

    /**
     * Most-hit entries first; content is not included.
     */
    @GetMapping("/entries")
    public ResponseEntity<List<CacheEntrySummary>> getEntries(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(orchestrator.cacheEntries(limit));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        orchestrator.clearCache();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "AI response cache cleared"
        ));
    }
}
