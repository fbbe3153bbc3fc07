package com.hearthside.provider;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OpenAiCompatibleModelClient.
 */
class OpenAiCompatibleModelClientTest extends ModelClientTestBase {

    private static final String PATH = "/api/v1/chat/completions";

    private OpenAiCompatibleModelClient client() {
        return new OpenAiCompatibleModelClient(webClient, properties, objectMapper);
    }

    @Test
    void testSuccessfulCompletion() {
        wireMockServer.stubFor(post(urlEqualTo(PATH))
                .willReturn(okJson("{\"id\":\"chatcmpl-9\",\"object\":\"chat.completion\","
                        + "\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"Buy milk\"}}],"
                        + "\"usage\":{\"prompt_tokens\":10,\"completion_tokens\":5,\"total_tokens\":15}}")));

        StepVerifier.create(client().invoke(MESSAGES, 300, 0.0))
                .assertNext(completion -> {
                    assertEquals("Buy milk", completion.getText());
                    assertEquals(15, completion.getTokensUsed());
                    assertEquals("chatcmpl-9", completion.getProviderRequestId());
                })
                .verifyComplete();

        wireMockServer.verify(postRequestedFor(urlEqualTo(PATH))
                .withHeader("Authorization", equalTo("Bearer test-key"))
                .withRequestBody(matchingJsonPath("$.messages[2].role", equalTo("user")))
                .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("300")))
                .withRequestBody(matchingJsonPath("$.temperature", equalTo("0.0")))
                .withRequestBody(matchingJsonPath("$.stream", equalTo("false"))));
    }

    @Test
    void testEmptyChoicesIsMalformed() {
        wireMockServer.stubFor(post(urlEqualTo(PATH))
                .willReturn(okJson("{\"id\":\"x\",\"choices\":[]}")));

        StepVerifier.create(client().invoke(MESSAGES, 300, 0.5))
                .expectErrorSatisfies(error -> assertEquals(ProviderException.Reason.MALFORMED_RESPONSE,
                        assertInstanceOf(ProviderException.class, error).getReason()))
                .verify();
    }

    @Test
    void testServerErrorCarriesStatus() {
        wireMockServer.stubFor(post(urlEqualTo(PATH))
                .willReturn(aResponse().withStatus(503)));

        StepVerifier.create(client().invoke(MESSAGES, 300, 0.5))
                .expectErrorSatisfies(error -> assertEquals(503,
                        assertInstanceOf(ProviderException.class, error).getStatus()))
                .verify();
    }

    @Test
    void testConnectionRefusedIsTransportFailure() {
        int port = wireMockServer.port();
        wireMockServer.stop();
        properties.getModel().setBaseUrl("http://localhost:" + port + "/api/v1");

        StepVerifier.create(client().invoke(MESSAGES, 300, 0.5))
                .expectErrorSatisfies(error -> assertEquals(ProviderException.Reason.TRANSPORT,
                        assertInstanceOf(ProviderException.class, error).getReason()))
                .verify();
    }
}
