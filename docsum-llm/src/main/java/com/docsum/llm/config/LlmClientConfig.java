package com.docsum.llm.config;

import com.docsum.common.concurrent.NamedThreadFactory;
import com.docsum.llm.exception.LlmConfigurationException;
import com.docsum.llm.generation.Generator;
import com.docsum.llm.generation.RateLimitedGenerator;
import com.docsum.llm.provider.LlmProvider;
import com.docsum.llm.provider.ProviderClient;
import com.docsum.llm.provider.clients.GeminiProviderClient;
import com.docsum.llm.provider.clients.OpenAiCompatibleProviderClient;
import com.docsum.llm.ratelimit.TokenBucketRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the generation stack once at startup:
 * provider client (chosen by {@code docsum.llm.provider}) → shared token bucket → generator.
 *
 * Misconfiguration fails the context with {@link LlmConfigurationException}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LlmClientConfig {

    private final LlmProperties properties;

    @Bean
    public ProviderClient providerClient(
            @Qualifier("llmWebClientBuilder") WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper) {
        return createProviderClient(properties, webClientBuilder, objectMapper);
    }

    @Bean
    public TokenBucketRateLimiter llmRateLimiter() {
        if (properties.getRequestsPerMinute() <= 0 || properties.getBurstCapacity() < 1) {
            throw new LlmConfigurationException(String.format(
                "Invalid rate limit: requests-per-minute=%d, burst-capacity=%s",
                properties.getRequestsPerMinute(), properties.getBurstCapacity()));
        }
        return new TokenBucketRateLimiter(
            "llm", properties.getRequestsPerMinute(), properties.getBurstCapacity());
    }

    @Bean(name = "generationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        if (properties.getGenerationThreads() <= 0) {
            throw new LlmConfigurationException("docsum.llm.generation-threads must be positive");
        }
        return Executors.newFixedThreadPool(properties.getGenerationThreads(), new NamedThreadFactory("llm-gen-"));
    }

    @Bean
    public Generator generator(
            ProviderClient providerClient,
            TokenBucketRateLimiter llmRateLimiter,
            @Qualifier("generationExecutor") ExecutorService generationExecutor) {
        return new RateLimitedGenerator(providerClient, llmRateLimiter, generationExecutor);
    }

    static ProviderClient createProviderClient(
            LlmProperties properties,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper) {
        LlmProvider provider = properties.resolveProvider();
        LlmProperties.ProviderSettings settings = properties.settingsFor(provider);

        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new LlmConfigurationException(String.format(
                "API key is required when LLM_PROVIDER=%s (docsum.llm.%s.api-key)",
                provider.name().toLowerCase(), provider.name().toLowerCase()));
        }
        if (settings.getModel() != null && settings.getModel().isBlank()) {
            throw new LlmConfigurationException("Model name for " + provider.getDisplayName() + " must not be blank");
        }
        if (properties.getMaxOutputTokens() <= 0) {
            throw new LlmConfigurationException("docsum.llm.max-output-tokens must be positive");
        }

        ProviderClient client = switch (provider) {
            case GEMINI -> new GeminiProviderClient(properties, webClientBuilder, objectMapper);
            case OPENAI, IONET -> new OpenAiCompatibleProviderClient(provider, properties, webClientBuilder, objectMapper);
        };

        log.info("[LLM] Provider selected | provider={} | model={} | rpm={} | burstCapacity={}",
            provider.getDisplayName(), client.getModel(),
            properties.getRequestsPerMinute(), properties.getBurstCapacity());
        return client;
    }
}
