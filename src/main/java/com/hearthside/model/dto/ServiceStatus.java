package com.hearthside.model.dto;

import com.hearthside.model.BudgetUsage;
import com.hearthside.model.RateLimitStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Overall gateway status for one caller. Only {@code enabled} is set when AI is switched off.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceStatus {
    private boolean enabled;
    private BudgetUsage budgetUsage;
    private CacheStatistics cacheStats;
    private RateLimitStatus rateLimitStatus;
}
