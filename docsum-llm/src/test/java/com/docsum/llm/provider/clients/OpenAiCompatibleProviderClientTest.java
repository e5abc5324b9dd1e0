package com.docsum.llm.provider.clients;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.docsum.llm.config.LlmProperties;
import com.docsum.llm.exception.GenerationException;
import com.docsum.llm.provider.LlmProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

@DisplayName("OpenAiCompatibleProviderClient Tests")
class OpenAiCompatibleProviderClientTest {

    private static final String COMPLETION =
            """
            {"id":"chatcmpl-1","choices":[{"index":0,
                "message":{"role":"assistant","content":"Combined summary"},"finish_reason":"stop"}]}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubExchange exchange;
    private LlmProperties properties;

    @BeforeEach
    void setUp() {
        exchange = new StubExchange();
        properties = new LlmProperties();
        properties.getOpenai().setApiKey("sk-test");
        properties.getIonet().setApiKey("io-test");
    }

    @Test
    @DisplayName("should return the first choice's message content")
    void shouldReturnContent_whenResponseIsValid() {
        exchange.respond(HttpStatus.OK, COMPLETION);

        OpenAiCompatibleProviderClient client =
                new OpenAiCompatibleProviderClient(
                        LlmProvider.OPENAI, properties, exchange.builder(), objectMapper);

        assertThat(client.generateContent("system", "user")).isEqualTo("Combined summary");
    }

    @Test
    @DisplayName("should post chat messages with bearer auth to the OpenAI endpoint")
    void shouldSendChatCompletionRequest() throws Exception {
        exchange.respond(HttpStatus.OK, COMPLETION);
        OpenAiCompatibleProviderClient client =
                new OpenAiCompatibleProviderClient(
                        LlmProvider.OPENAI, properties, exchange.builder(), objectMapper);

        client.generateContent("map system", "Summarize this section:\n\ntext");

        assertThat(exchange.lastRequest().url().toString())
                .isEqualTo("https://api.openai.com/v1/chat/completions");
        assertThat(exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION))
                .isEqualTo("Bearer sk-test");

        JsonNode body = objectMapper.readTree(exchange.lastBody());
        assertThat(body.get("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(body.at("/messages/0/role").asText()).isEqualTo("system");
        assertThat(body.at("/messages/0/content").asText()).isEqualTo("map system");
        assertThat(body.at("/messages/1/role").asText()).isEqualTo("user");
        assertThat(body.at("/messages/1/content").asText())
                .isEqualTo("Summarize this section:\n\ntext");
        assertThat(body.get("max_tokens").asInt()).isEqualTo(1500);
    }

    @Test
    @DisplayName("should target io.net with its own key, base URL and default model")
    void shouldTargetIoNet() throws Exception {
        exchange.respond(HttpStatus.OK, COMPLETION);
        OpenAiCompatibleProviderClient client =
                new OpenAiCompatibleProviderClient(
                        LlmProvider.IONET, properties, exchange.builder(), objectMapper);

        client.generateContent("s", "u");

        assertThat(client.getProvider()).isEqualTo(LlmProvider.IONET);
        assertThat(exchange.lastRequest().url().toString())
                .isEqualTo("https://api.intelligence.io.solutions/api/v1/chat/completions");
        assertThat(exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION))
                .isEqualTo("Bearer io-test");
        assertThat(objectMapper.readTree(exchange.lastBody()).get("model").asText())
                .isEqualTo("deepseek-ai/DeepSeek-V3");
    }

    @Test
    @DisplayName("should honour a base URL override")
    void shouldUseBaseUrlOverride() {
        properties.getIonet().setBaseUrl("http://localhost:9999/v1");
        exchange.respond(HttpStatus.OK, COMPLETION);

        new OpenAiCompatibleProviderClient(
                        LlmProvider.IONET, properties, exchange.builder(), objectMapper)
                .generateContent("s", "u");

        assertThat(exchange.lastRequest().url().toString())
                .isEqualTo("http://localhost:9999/v1/chat/completions");
    }

    @Test
    @DisplayName("should report a retryable failure on a 5xx response")
    void shouldMapServerError() {
        exchange.respond(
                HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":{\"message\":\"The server is overloaded\"}}");
        OpenAiCompatibleProviderClient client =
                new OpenAiCompatibleProviderClient(
                        LlmProvider.OPENAI, properties, exchange.builder(), objectMapper);

        assertThatThrownBy(() -> client.generateContent("s", "u"))
                .isInstanceOfSatisfying(
                        GenerationException.class,
                        e -> {
                            assertThat(e.getStatusCode()).isEqualTo(503);
                            assertThat(e.isRetryable()).isTrue();
                            assertThat(e.isRateLimited()).isFalse();
                            assertThat(e.getMessage()).contains("The server is overloaded");
                        });
    }

    @Test
    @DisplayName("should fail when the completion has no content")
    void shouldFail_whenContentMissing() {
        exchange.respond(HttpStatus.OK, "{\"choices\":[]}");
        OpenAiCompatibleProviderClient client =
                new OpenAiCompatibleProviderClient(
                        LlmProvider.OPENAI, properties, exchange.builder(), objectMapper);

        assertThatThrownBy(() -> client.generateContent("s", "u"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("no message content");
    }

    @Test
    @DisplayName("should report an interrupted request as not retryable and keep the interrupt flag")
    void shouldKeepInterruptFlag_whenInterruptedWhileWaiting() throws Exception {
        exchange.hang();
        OpenAiCompatibleProviderClient client =
                new OpenAiCompatibleProviderClient(
                        LlmProvider.OPENAI, properties, exchange.builder(), objectMapper);
        AtomicReference<GenerationException> failure = new AtomicReference<>();
        AtomicBoolean stillInterrupted = new AtomicBoolean();
        Thread caller =
                new Thread(
                        () -> {
                            try {
                                client.generateContent("s", "u");
                            } catch (GenerationException e) {
                                failure.set(e);
                                stillInterrupted.set(Thread.currentThread().isInterrupted());
                            }
                        });
        caller.start();
        assertThat(exchange.sent.await(5, TimeUnit.SECONDS)).isTrue();

        caller.interrupt();
        caller.join(5_000);

        assertThat(failure.get()).isNotNull();
        assertThat(failure.get().isRetryable()).isFalse();
        assertThat(failure.get().getMessage()).contains("interrupted");
        assertThat(stillInterrupted.get()).isTrue();
    }
}
