package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a pre-call affordability check.
 */
@Value
@Builder
public class BudgetDecision {
    boolean allowed;
    String reason;
    BudgetUsage usage;
}
