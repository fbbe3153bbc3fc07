package com.hearthside.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hearthside.config.HearthsideProperties;
import com.hearthside.model.ChatMessage;
import com.hearthside.model.ModelCompletion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Client for any OpenAI-compatible {@code /chat/completions} endpoint
 * (OpenAI, DashScope compatible mode, local gateways).
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hearthside.ai.model", name = "provider", havingValue = "openai")
public class OpenAiCompatibleModelClient extends AbstractModelClient {

    public OpenAiCompatibleModelClient(
            WebClient webClient,
            HearthsideProperties properties,
            ObjectMapper objectMapper) {
        super(webClient, properties, objectMapper);
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    protected String endpointPath() {
        return "/chat/completions";
    }

    @Override
    protected JsonNode buildRequestBody(List<ChatMessage> messages, int maxTokens, double temperature) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", config.getName());

        ArrayNode messagesArray = request.putArray("messages");
        for (ChatMessage message : messages) {
            messagesArray.addObject()
                    .put("role", message.getRole())
                    .put("content", message.getContent());
        }

        request.put("max_tokens", maxTokens);
        request.put("temperature", temperature);
        request.put("stream", false);
        return request;
    }

    @Override
    protected ModelCompletion parseResponse(JsonNode response) {
        JsonNode choices = response.path("choices");
        String text = choices.isArray() && choices.size() > 0
                ? textOrNull(choices.get(0).path("message").path("content"))
                : null;
        if (text == null || text.isBlank()) {
            throw ProviderException.malformed("openai response has no message content");
        }

        return ModelCompletion.builder()
                .text(text.trim())
                .tokensUsed(response.path("usage").path("total_tokens").asInt(0))
                .providerRequestId(textOrNull(response.path("id")))
                .build();
    }
}
