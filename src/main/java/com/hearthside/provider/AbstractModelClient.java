package com.hearthside.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hearthside.config.HearthsideProperties;
import com.hearthside.model.ChatMessage;
import com.hearthside.model.ModelCompletion;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for model clients: one JSON POST per call, failures normalised
 * into {@link ProviderException}.
 */
@Slf4j
public abstract class AbstractModelClient implements ModelClient {

    protected final WebClient webClient;
    protected final HearthsideProperties.ModelConfig config;
    protected final ObjectMapper objectMapper;

    protected AbstractModelClient(
            WebClient webClient,
            HearthsideProperties properties,
            ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.config = properties.getModel();
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isEnabled() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public Mono<ModelCompletion> invoke(List<ChatMessage> messages, int maxTokens, double temperature) {
        if (!isEnabled()) {
            return Mono.error(ProviderException.status(401, getName() + " provider has no API key", null));
        }

        log.debug("Calling {}: model={}, messages={}, maxTokens={}, temperature={}",
                getName(), config.getName(), messages.size(), maxTokens, temperature);

        JsonNode body = buildRequestBody(messages, maxTokens, temperature);

        return webClient.post()
                .uri(config.getBaseUrl() + endpointPath())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(this::addProviderHeaders)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .switchIfEmpty(Mono.error(() -> ProviderException.malformed(getName() + " returned an empty body")))
                .map(this::parseResponse)
                .onErrorMap(error -> !(error instanceof ProviderException), this::toProviderException)
                .doOnSuccess(completion -> log.debug("{} call succeeded: tokens={}, providerRequestId={}",
                        getName(), completion.getTokensUsed(), completion.getProviderRequestId()))
                .doOnError(error -> log.warn("{} call failed: {}", getName(), error.getMessage()));
    }

    /**
     * Path appended to the configured base URL.
     */
    protected abstract String endpointPath();

    /**
     * Provider-specific JSON request body.
     */
    protected abstract JsonNode buildRequestBody(List<ChatMessage> messages, int maxTokens, double temperature);

    /**
     * Extract the completion; throw {@link ProviderException#malformed} when required fields are missing.
     */
    protected abstract ModelCompletion parseResponse(JsonNode response);

    /**
     * Extra headers beyond authorization and content type.
     */
    protected void addProviderHeaders(HttpHeaders headers) {
    }

    /**
     * Map a WebClient / Reactor failure to a provider failure.
     */
    protected ProviderException toProviderException(Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException responseError = (WebClientResponseException) error;
            int status = responseError.getStatusCode().value();
            return ProviderException.status(status,
                    getName() + " responded with HTTP " + status, error);
        }
        if (error instanceof TimeoutException) {
            return ProviderException.timeout(getName() + " call timed out after " + config.getTimeout(), error);
        }
        if (error instanceof WebClientRequestException) {
            Throwable cause = error.getCause();
            if (cause instanceof ReadTimeoutException || cause instanceof TimeoutException) {
                return ProviderException.timeout(getName() + " call timed out", error);
            }
            return ProviderException.transport(getName() + " unreachable: " + error.getMessage(), error);
        }
        if (error instanceof DecodingException) {
            return new ProviderException(ProviderException.Reason.MALFORMED_RESPONSE, null,
                    getName() + " returned an unreadable body", error);
        }
        return ProviderException.transport(getName() + " call failed: " + error.getMessage(), error);
    }

    protected static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
