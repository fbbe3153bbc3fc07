package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

/**
 * Normalised result of one provider call.
 */
@Value
@Builder
public class ModelCompletion {

    String text;

    /**
     * Total tokens (input + output) billed by the provider.
     */
    int tokensUsed;

    /**
     * Provider-side request id; may be null.
     */
    String providerRequestId;
}
