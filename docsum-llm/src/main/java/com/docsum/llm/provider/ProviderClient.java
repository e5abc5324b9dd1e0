package com.docsum.llm.provider;

import com.docsum.llm.exception.GenerationException;

/**
 * Blocking call to one generation backend. Implementations hold no per-request state and
 * are shared by every summarization run. Rate limiting is not their concern; see
 * {@link com.docsum.llm.generation.RateLimitedGenerator}.
 */
public interface ProviderClient {
    
    String generateContent(String systemPrompt, String userPrompt) throws GenerationException;
    
    LlmProvider getProvider();
    
    String getModel();
}
