package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of one rate-limit tier.
 */
@Value
@Builder
public class TierStatus {
    int used;
    int limit;
    int remaining;
    Instant resetAt;
}
