package com.hearthside.service;

import com.hearthside.model.AiRequest;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Input checks applied before any policy is consulted.
 */
@Component
public class RequestValidator {

    public static final int MAX_PROMPT_LENGTH = 2000;
    public static final int MAX_CONTEXT_LENGTH = 1000;
    public static final int MIN_MAX_TOKENS = 100;
    public static final int MAX_MAX_TOKENS = 4000;
    public static final double MIN_TEMPERATURE = 0.0;
    public static final double MAX_TEMPERATURE = 2.0;

    /**
     * @return the first problem found, or empty when the request is acceptable
     */
    public Optional<String> validate(AiRequest request) {
        if (request == null) {
            return Optional.of("Request is required");
        }
        if (isBlank(request.getCallerId()) || isBlank(request.getTenantId())) {
            return Optional.of("Caller and tenant identity are required");
        }

        String prompt = request.getPrompt();
        if (prompt == null || prompt.isEmpty()) {
            return Optional.of("Prompt must not be empty");
        }
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            return Optional.of("Prompt must be at most " + MAX_PROMPT_LENGTH + " characters");
        }
        if (request.getContext() != null && request.getContext().length() > MAX_CONTEXT_LENGTH) {
            return Optional.of("Context must be at most " + MAX_CONTEXT_LENGTH + " characters");
        }
        if (request.getCategory() == null) {
            return Optional.of("Request type is required");
        }

        Integer maxTokens = request.getMaxTokens();
        if (maxTokens != null && (maxTokens < MIN_MAX_TOKENS || maxTokens > MAX_MAX_TOKENS)) {
            return Optional.of("maxTokens must be between " + MIN_MAX_TOKENS + " and " + MAX_MAX_TOKENS);
        }

        Double temperature = request.getTemperature();
        if (temperature != null
                && (temperature.isNaN() || temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)) {
            return Optional.of("temperature must be between 0 and 2");
        }

        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
