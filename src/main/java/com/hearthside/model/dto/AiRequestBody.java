package com.hearthside.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON body of {@code POST /api/ai/request}. The caller identity comes from headers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiRequestBody {

    @JsonProperty("prompt")
    private String prompt;

    @JsonProperty("context")
    private String context;

    /**
     * Category wire value, e.g. "meal_planning".
     */
    @JsonProperty("requestType")
    private String requestType;

    @JsonProperty("maxTokens")
    private Integer maxTokens;

    @JsonProperty("temperature")
    private Double temperature;
}
