package com.hearthside.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One tracked caller in the rate-limit admin listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateWindowSummary {
    private String key;
    private int minuteCount;
    private int hourCount;
    private int dayCount;

    /**
     * Earliest reset instant across the three tiers.
     */
    private Instant nextReset;
}
