package com.hearthside.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response cache statistics for the admin dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Number of live entries.
     */
    private int size;

    /**
     * Configured capacity.
     */
    private int maxSize;

    /**
     * Average hits per entry, rounded to two decimals.
     */
    private double hitRate;

    /**
     * Total cache hits across all live entries.
     */
    private long totalHits;

    /**
     * Creation time of the oldest and newest live entry; null when empty.
     */
    private Instant oldestEntry;
    private Instant newestEntry;
}
