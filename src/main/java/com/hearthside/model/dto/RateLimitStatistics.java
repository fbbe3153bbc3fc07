package com.hearthside.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate rate-limiter statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatistics {

    /**
     * Callers with a tracked window.
     */
    private int totalCallers;

    /**
     * Callers with requests inside their current hour window.
     */
    private int activeCallers;

    private long minuteRequests;
    private long hourRequests;
    private long dayRequests;
}
