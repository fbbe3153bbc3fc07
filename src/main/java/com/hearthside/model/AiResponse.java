package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Successful outcome of the pipeline.
 */
@Value
@Builder
public class AiResponse {

    String content;
    int tokenCount;

    /**
     * Marginal cost of this response; zero when served from cache.
     */
    BigDecimal cost;

    String requestId;
    boolean servedFromCache;

    /**
     * Generation time. For cache hits this is when the entry was created.
     */
    Instant timestamp;
}
