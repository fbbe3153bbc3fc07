package com.hearthside.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.hearthside.config.HearthsideProperties;
import com.hearthside.config.JacksonConfiguration;
import com.hearthside.model.ChatMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Starts a WireMock server standing in for the provider on a random port.
 */
abstract class ModelClientTestBase {

    protected static final List<ChatMessage> MESSAGES = List.of(
            ChatMessage.system("You are a family meal planner."),
            ChatMessage.user("Context: two kids"),
            ChatMessage.user("Plan dinners for the week"));

    protected WireMockServer wireMockServer;
    protected HearthsideProperties properties;
    protected ObjectMapper objectMapper;
    protected WebClient webClient;

    @BeforeEach
    void startServer() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        properties = new HearthsideProperties();
        properties.getModel().setApiKey("test-key");
        properties.getModel().setBaseUrl(wireMockServer.baseUrl() + "/api/v1");
        properties.getModel().setTimeout(Duration.ofSeconds(5));
        objectMapper = JacksonConfiguration.configure(new ObjectMapper());
        webClient = WebClient.builder().build();
    }

    @AfterEach
    void stopServer() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.resetAll();
            wireMockServer.stop();
        }
    }
}
