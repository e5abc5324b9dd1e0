package com.docsum.llm.provider;

import com.docsum.llm.exception.LlmConfigurationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Supported generation backends. Exactly one is selected at startup.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {
    
    OPENAI(
        "OpenAI",
        "https://api.openai.com/v1",
        "gpt-4o-mini"
    ),
    
    GEMINI(
        "Gemini",
        "https://generativelanguage.googleapis.com/v1beta",
        "gemini-2.0-flash"
    ),
    
    // OpenAI-compatible API
    IONET(
        "io.net",
        "https://api.intelligence.io.solutions/api/v1",
        "deepseek-ai/DeepSeek-V3"
    );
    
    private final String displayName;
    private final String defaultBaseUrl;
    private final String defaultModel;
    
    public static LlmProvider fromString(String name) {
        if (name != null) {
            for (LlmProvider provider : values()) {
                if (provider.name().equalsIgnoreCase(name.trim()) ||
                    provider.getDisplayName().equalsIgnoreCase(name.trim())) {
                    return provider;
                }
            }
        }
        throw new LlmConfigurationException(
            "Unknown LLM provider: " + name + ". Use 'openai', 'gemini', or 'ionet'");
    }
}
