package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Spend snapshot for a caller or tenant. Token and request totals cover the current month.
 */
@Value
@Builder
public class BudgetUsage {
    BigDecimal dailyUsed;
    BigDecimal monthlyUsed;
    BigDecimal dailyRemaining;
    BigDecimal monthlyRemaining;
    long tokensUsed;
    long requestCount;
    BigDecimal averageCost;
}
