package com.docsum.llm.config;

import com.docsum.llm.provider.LlmProvider;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "docsum.llm")
@Getter
@Setter
public class LlmProperties {
    private String provider = "gemini"; // "openai", "gemini" or "ionet"
    private double temperature = 0.3;
    private int maxOutputTokens = 1500;
    private int timeoutSeconds = 60;
    private int requestsPerMinute = 5;
    private double burstCapacity = 1;
    private int generationThreads = 16;
    
    private ProviderSettings openai = new ProviderSettings();
    private ProviderSettings gemini = new ProviderSettings();
    private ProviderSettings ionet = new ProviderSettings();
    
    public LlmProvider resolveProvider() {
        return LlmProvider.fromString(provider);
    }
    
    public ProviderSettings settingsFor(LlmProvider llmProvider) {
        return switch (llmProvider) {
            case OPENAI -> openai;
            case GEMINI -> gemini;
            case IONET -> ionet;
        };
    }
    
    @Getter
    @Setter
    public static class ProviderSettings {
        private String apiKey;
        private String model; // null falls back to the provider default
        private String baseUrl; // null falls back to the provider default
    }
}
