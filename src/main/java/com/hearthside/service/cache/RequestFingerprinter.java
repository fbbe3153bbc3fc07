package com.hearthside.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hearthside.config.HearthsideProperties;
import com.hearthside.model.AiRequest;
import com.hearthside.model.Fingerprint;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

/**
 * Derives the cache key of a request.
 *
 * Steps:
 * 1. Resolve effective max tokens and temperature against the model defaults
 * 2. Render prompt, context, category, max tokens, temperature as JSON in that fixed order
 * 3. SHA-256 the rendering
 *
 * Text is hashed as given: no trimming or case folding, so "Hi" and "hi " are different keys.
 * Caller identity is not part of the key; equivalent requests from different callers share entries.
 */
@Slf4j
@Service
public class RequestFingerprinter {

    private final ObjectMapper objectMapper;
    private final HearthsideProperties.ModelConfig modelConfig;

    public RequestFingerprinter(HearthsideProperties properties, ObjectMapper objectMapper) {
        this.modelConfig = properties.getModel();
        this.objectMapper = objectMapper;
    }

    /**
     * @param request request to key
     * @return SHA-256 fingerprint (64 hex chars)
     */
    public Fingerprint fingerprint(AiRequest request) {
        String canonical = canonicalize(request);
        Fingerprint fingerprint = new Fingerprint(DigestUtils.sha256Hex(canonical));
        log.trace("Fingerprint {} for {}", fingerprint.preview(), canonical);
        return fingerprint;
    }

    /**
     * Canonical JSON rendering of the policy-equivalence fields.
     */
    public String canonicalize(AiRequest request) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("prompt", request.getPrompt());
        node.put("context", request.contextOrEmpty());
        node.put("category", request.getCategory() != null ? request.getCategory().getValue() : null);
        node.put("maxTokens", request.effectiveMaxTokens(modelConfig.getMaxTokens()));
        // Adding 0.0 folds -0.0 into 0.0
        node.put("temperature", request.effectiveTemperature(modelConfig.getTemperature()) + 0.0);

        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render request fingerprint", e);
        }
    }
}
