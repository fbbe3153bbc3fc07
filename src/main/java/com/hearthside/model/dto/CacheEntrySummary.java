package com.hearthside.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Summary view of a cache entry for list endpoints.
 * The fingerprint is truncated; content is not exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntrySummary {

    /**
     * First 16 hex chars of the fingerprint.
     */
    private String key;

    private int tokens;

    private long hitCount;

    /**
     * Seconds since the entry was created.
     */
    private long ageSeconds;

    private Instant createdAt;

    private Instant lastHit;
}
