package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

/**
 * An authenticated request for generated text.
 *
 * Two requests are policy-equivalent (served by the same cache entry) when prompt,
 * context, category, effective max tokens and effective temperature are all equal.
 * An absent context is equivalent to an empty one.
 */
@Value
@Builder(toBuilder = true)
public class AiRequest {

    String prompt;

    /**
     * Optional background information, sent as a turn before the prompt.
     */
    String context;

    RequestCategory category;

    /**
     * Overrides; null means "use the configured model default".
     */
    Integer maxTokens;
    Double temperature;

    String callerId;
    String tenantId;

    public CallerKey callerKey() {
        return CallerKey.of(tenantId, callerId);
    }

    public String contextOrEmpty() {
        return context != null ? context : "";
    }

    public boolean hasContext() {
        return context != null && !context.isEmpty();
    }

    public int effectiveMaxTokens(int defaultMaxTokens) {
        return maxTokens != null ? maxTokens : defaultMaxTokens;
    }

    public double effectiveTemperature(double defaultTemperature) {
        return temperature != null ? temperature : defaultTemperature;
    }
}
