package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable record of one billed provider call.
 */
@Value
@Builder
public class UsageRecord {
    String id;
    String callerId;
    String tenantId;
    RequestCategory category;
    int tokens;
    BigDecimal cost;
    String requestId;
    Instant timestamp;
}
