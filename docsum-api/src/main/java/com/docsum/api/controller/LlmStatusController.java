package com.docsum.api.controller;

import com.docsum.api.dto.response.LlmStatusResponse;
import com.docsum.llm.config.LlmProperties;
import com.docsum.llm.provider.ProviderClient;
import com.docsum.llm.ratelimit.TokenBucketRateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/llm")
@RequiredArgsConstructor
public class LlmStatusController {
    
    private final ProviderClient providerClient;
    private final TokenBucketRateLimiter llmRateLimiter;
    private final LlmProperties llmProperties;
    
    @GetMapping("/status")
    public ResponseEntity<LlmStatusResponse> getStatus() {
        return ResponseEntity.ok(LlmStatusResponse.builder()
            .provider(providerClient.getProvider().getDisplayName())
            .model(providerClient.getModel())
            .requestsPerMinute(llmProperties.getRequestsPerMinute())
            .burstCapacity(llmRateLimiter.getCapacity())
            .availableTokens(llmRateLimiter.getAvailableTokens())
            .build());
    }
}
