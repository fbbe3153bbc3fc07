package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a rate-limit check. {@code tier} and {@code reason} are set only when refused.
 */
@Value
@Builder
public class RateLimitDecision {
    boolean allowed;
    String reason;
    RateTier tier;
    RateLimitStatus status;
}
