package com.docsum.llm.provider.clients;

import com.docsum.common.concurrent.Interruptions;
import com.docsum.llm.config.LlmProperties;
import com.docsum.llm.exception.GenerationException;
import com.docsum.llm.model.GeminiResponse;
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

@Slf4j
public class GeminiProviderClient implements ProviderClient {
    
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;
    private final Duration timeout;
    
    public GeminiProviderClient(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        LlmProperties.ProviderSettings settings = properties.getGemini();
        this.objectMapper = objectMapper;
        this.model = settings.getModel() != null ? settings.getModel() : LlmProvider.GEMINI.getDefaultModel();
        this.temperature = properties.getTemperature();
        this.maxOutputTokens = properties.getMaxOutputTokens();
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        this.webClient = webClientBuilder.clone()
            .baseUrl(settings.getBaseUrl() != null ? settings.getBaseUrl() : LlmProvider.GEMINI.getDefaultBaseUrl())
            .defaultHeader("Content-Type", "application/json")
            .defaultHeader("x-goog-api-key", settings.getApiKey())
            .build();
    }
    
    @Override
    public String generateContent(String systemPrompt, String userPrompt) throws GenerationException {
        long startTime = System.currentTimeMillis();
        
        log.debug("[GEMINI] Starting content generation | model={} | promptLength={}", model, userPrompt.length());
        
        Map<String, Object> request = Map.of(
            "systemInstruction", Map.of(
                "parts", List.of(Map.of("text", systemPrompt))
            ),
            "contents", List.of(
                Map.of("role", "user", "parts", List.of(Map.of("text", userPrompt)))
            ),
            "generationConfig", Map.of(
                "maxOutputTokens", maxOutputTokens,
                "temperature", temperature
            )
        );
        
        String response;
        try {
            response = webClient.post()
                .uri("/models/{model}:generateContent", model)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("[GEMINI] HTTP error | model={} | statusCode={} | statusText={} | durationMs={}", 
                model, e.getStatusCode().value(), e.getStatusText(), duration);
            throw mapException(e);
        } catch (Exception e) {
            if (Interruptions.isInterruption(e)) {
                Thread.currentThread().interrupt();
                log.warn("[GEMINI] Request interrupted | model={} | durationMs={}",
                    model, System.currentTimeMillis() - startTime);
                throw new GenerationException(
                    "Gemini request interrupted",
                    LlmProvider.GEMINI, GenerationException.NO_STATUS, false, e
                );
            }
            long duration = System.currentTimeMillis() - startTime;
            log.error("[GEMINI] Request failed | model={} | durationMs={} | error={}", 
                model, duration, e.getMessage());
            throw new GenerationException(
                "Gemini request failed: " + e.getMessage(),
                LlmProvider.GEMINI, GenerationException.NO_STATUS, true, e
            );
        }
        
        String content = extractContent(response);
        log.debug("[GEMINI] Content generated | model={} | durationMs={} | responseLength={}", 
            model, System.currentTimeMillis() - startTime, content.length());
        return content;
    }
    
    private String extractContent(String response) throws GenerationException {
        GeminiResponse parsed;
        try {
            parsed = objectMapper.readValue(response, GeminiResponse.class);
        } catch (Exception e) {
            throw new GenerationException(
                "Failed to parse Gemini response",
                LlmProvider.GEMINI, GenerationException.NO_STATUS, false, e
            );
        }
        
        GeminiResponse.Candidate candidate = parsed == null ? null : parsed.firstCandidate();
        if (candidate == null) {
            throw malformed("response contained no candidates");
        }
        
        String finishReason = candidate.getFinishReason();
        if ("SAFETY".equals(finishReason)) {
            String safetyMessage = candidate.getFinishMessage() != null
                ? candidate.getFinishMessage() : "Content was blocked by safety filters";
            throw malformed("blocked by safety filters: " + safetyMessage);
        }
        if ("RECITATION".equals(finishReason)) {
            throw malformed("blocked due to recitation concerns");
        }
        
        String text = candidate.firstText();
        if (text == null || text.isBlank()) {
            throw malformed("no text in response. Finish reason: " + finishReason);
        }
        
        if ("MAX_TOKENS".equals(finishReason)) {
            log.warn("[GEMINI] Response truncated by MAX_TOKENS | model={} | responseLength={} | maxOutputTokens={}", 
                model, text.length(), maxOutputTokens);
        }
        if (parsed.getUsageMetadata() != null) {
            log.debug("[GEMINI] Token usage | model={} | promptTokens={} | outputTokens={}",
                model, parsed.getUsageMetadata().getPromptTokenCount(),
                parsed.getUsageMetadata().getCandidatesTokenCount());
        }
        return text;
    }
    
    private GenerationException malformed(String detail) {
        return new GenerationException(
            "Gemini generation failed: " + detail,
            LlmProvider.GEMINI, GenerationException.NO_STATUS, false
        );
    }
    
    private GenerationException mapException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        boolean retryable = status == 429 || status >= 500;
        String message = String.format("Gemini API error: %d %s", status, e.getStatusText());
        
        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            if (error.has("error") && error.get("error").has("message")) {
                message = "Gemini API error: " + status + " " + error.get("error").get("message").asText();
            }
        } catch (Exception parseFailure) {
            log.debug("[GEMINI] Error body is not JSON | statusCode={}", status);
        }
        
        return new GenerationException(message, LlmProvider.GEMINI, status, retryable, e);
    }
    
    @Override
    public LlmProvider getProvider() {
        return LlmProvider.GEMINI;
    }
    
    @Override
    public String getModel() {
        return model;
    }
}
