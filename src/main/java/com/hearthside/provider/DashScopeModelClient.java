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
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Tongyi Qianwen (DashScope text-generation API) client.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hearthside.ai.model", name = "provider", havingValue = "dashscope", matchIfMissing = true)
public class DashScopeModelClient extends AbstractModelClient {

    private static final double TOP_P = 0.9;
    private static final double REPETITION_PENALTY = 1.1;

    public DashScopeModelClient(
            WebClient webClient,
            HearthsideProperties properties,
            ObjectMapper objectMapper) {
        super(webClient, properties, objectMapper);
    }

    @Override
    public String getName() {
        return "dashscope";
    }

    @Override
    protected String endpointPath() {
        return "/services/aigc/text-generation/generation";
    }

    @Override
    protected void addProviderHeaders(HttpHeaders headers) {
        headers.add("X-DashScope-SSE", "disable");
    }

    @Override
    protected JsonNode buildRequestBody(List<ChatMessage> messages, int maxTokens, double temperature) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", config.getName());

        ArrayNode messagesArray = request.putObject("input").putArray("messages");
        for (ChatMessage message : messages) {
            messagesArray.addObject()
                    .put("role", message.getRole())
                    .put("content", message.getContent());
        }

        ObjectNode parameters = request.putObject("parameters");
        parameters.put("max_tokens", maxTokens);
        parameters.put("temperature", temperature);
        parameters.put("top_p", TOP_P);
        parameters.put("repetition_penalty", REPETITION_PENALTY);

        return request;
    }

    @Override
    protected ModelCompletion parseResponse(JsonNode response) {
        String text = textOrNull(response.path("output").path("text"));
        if (text == null || text.isBlank()) {
            throw ProviderException.malformed("dashscope response has no output text");
        }

        return ModelCompletion.builder()
                .text(text.trim())
                .tokensUsed(response.path("usage").path("total_tokens").asInt(0))
                .providerRequestId(textOrNull(response.path("request_id")))
                .build();
    }
}
