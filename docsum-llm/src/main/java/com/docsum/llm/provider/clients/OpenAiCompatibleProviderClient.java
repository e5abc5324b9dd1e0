package com.docsum.llm.provider.clients;

import com.docsum.common.concurrent.Interruptions;
import com.docsum.llm.config.LlmProperties;
import com.docsum.llm.exception.GenerationException;
import com.docsum.llm.provider.LlmProvider;
import com.docsum.llm.provider.ProviderClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client shared by OpenAI and OpenAI-compatible hosts such as io.net.
 */
@Slf4j
public class OpenAiCompatibleProviderClient implements ProviderClient {
    
    private final LlmProvider provider;
    private final String tag;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;
    private final Duration timeout;
    
    public OpenAiCompatibleProviderClient(
            LlmProvider provider,
            LlmProperties properties,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper) {
        LlmProperties.ProviderSettings settings = properties.settingsFor(provider);
        this.provider = provider;
        this.tag = "[" + provider.name() + "]";
        this.objectMapper = objectMapper;
        this.model = settings.getModel() != null ? settings.getModel() : provider.getDefaultModel();
        this.temperature = properties.getTemperature();
        this.maxOutputTokens = properties.getMaxOutputTokens();
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        this.webClient = webClientBuilder.clone()
            .baseUrl(settings.getBaseUrl() != null ? settings.getBaseUrl() : provider.getDefaultBaseUrl())
            .defaultHeader("Content-Type", "application/json")
            .defaultHeader("Authorization", "Bearer " + settings.getApiKey())
            .build();
    }
    
    @Override
    public String generateContent(String systemPrompt, String userPrompt) throws GenerationException {
        long startTime = System.currentTimeMillis();
        
        log.debug("{} Starting content generation | model={} | promptLength={}", tag, model, userPrompt.length());
        
        Map<String, Object> request = Map.of(
            "model", model,
            "messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)
            ),
            "max_tokens", maxOutputTokens,
            "temperature", temperature
        );
        
        String response;
        try {
            response = webClient.post()
                .uri("/chat/completions")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("{} HTTP error | model={} | statusCode={} | statusText={} | durationMs={}", 
                tag, model, e.getStatusCode().value(), e.getStatusText(), duration);
            throw mapException(e);
        } catch (Exception e) {
            if (Interruptions.isInterruption(e)) {
                Thread.currentThread().interrupt();
                log.warn("{} Request interrupted | model={} | durationMs={}",
                    tag, model, System.currentTimeMillis() - startTime);
                throw new GenerationException(
                    provider.getDisplayName() + " request interrupted",
                    provider, GenerationException.NO_STATUS, false, e
                );
            }
            long duration = System.currentTimeMillis() - startTime;
            log.error("{} Request failed | model={} | durationMs={} | error={}", 
                tag, model, duration, e.getMessage());
            throw new GenerationException(
                provider.getDisplayName() + " request failed: " + e.getMessage(),
                provider, GenerationException.NO_STATUS, true, e
            );
        }
        
        String content = extractContent(response);
        log.debug("{} Content generated | model={} | durationMs={} | responseLength={}", 
            tag, model, System.currentTimeMillis() - startTime, content.length());
        return content;
    }
    
    private String extractContent(String response) throws GenerationException {
        JsonNode choice;
        try {
            JsonNode root = objectMapper.readTree(response);
            choice = root.path("choices").path(0);
        } catch (Exception e) {
            throw new GenerationException(
                "Failed to parse " + provider.getDisplayName() + " response",
                provider, GenerationException.NO_STATUS, false, e
            );
        }
        
        String content = choice.path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new GenerationException(
                provider.getDisplayName() + " response contained no message content",
                provider, GenerationException.NO_STATUS, false
            );
        }
        if ("length".equals(choice.path("finish_reason").asText())) {
            log.warn("{} Response truncated by max_tokens | model={} | responseLength={} | maxOutputTokens={}", 
                tag, model, content.length(), maxOutputTokens);
        }
        return content;
    }
    
    private GenerationException mapException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        boolean retryable = status == 429 || status >= 500;
        String message = String.format("%s API error: %d %s", provider.getDisplayName(), status, e.getStatusText());
        
        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            if (error.has("error") && error.get("error").has("message")) {
                message = provider.getDisplayName() + " API error: " + status + " "
                    + error.get("error").get("message").asText();
            }
        } catch (Exception parseFailure) {
            log.debug("{} Error body is not JSON | statusCode={}", tag, status);
        }
        
        return new GenerationException(message, provider, status, retryable, e);
    }
    
    @Override
    public LlmProvider getProvider() {
        return provider;
    }
    
    @Override
    public String getModel() {
        return model;
    }
}
