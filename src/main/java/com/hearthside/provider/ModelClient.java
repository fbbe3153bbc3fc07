package com.hearthside.provider;

import com.hearthside.model.ChatMessage;
import com.hearthside.model.ModelCompletion;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for the upstream text-generation provider.
 * Implementations handle provider-specific authentication, request/response mapping,
 * and API communication. They never retry.
 */
public interface ModelClient {

    /**
     * Get provider name (e.g., "dashscope", "openai").
     *
     * @return provider name
     */
    String getName();

    /**
     * Generate a completion.
     *
     * @param messages conversation, system prompt first
     * @param maxTokens output token ceiling
     * @param temperature sampling temperature
     * @return normalised completion, or a {@link ProviderException} error signal
     */
    Mono<ModelCompletion> invoke(List<ChatMessage> messages, int maxTokens, double temperature);

    /**
     * Check if provider is configured with credentials.
     *
     * @return true if ready to use
     */
    boolean isEnabled();
}
