package com.docsum.llm.generation;

import com.docsum.common.concurrent.CancellableFutures;
import com.docsum.common.util.TokenCounter;
import com.docsum.llm.exception.GenerationException;
import com.docsum.llm.provider.ProviderClient;
import com.docsum.llm.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Generator} backed by a {@link ProviderClient}. Every call, from every run, first
 * takes a permit from the shared {@link RateLimiter}, then performs the blocking provider
 * call on the generation executor.
 */
@RequiredArgsConstructor
@Slf4j
public class RateLimitedGenerator implements Generator {

    private final ProviderClient providerClient;
    private final RateLimiter rateLimiter;
    private final ExecutorService executor;

    private final AtomicLong callSequence = new AtomicLong();

    @Override
    public CompletableFuture<String> generate(String systemPrompt, String userPrompt) {
        long callId = callSequence.incrementAndGet();
        return CancellableFutures.submit(executor, () -> execute(callId, systemPrompt, userPrompt));
    }

    private String execute(long callId, String systemPrompt, String userPrompt) {
        long queuedAt = System.currentTimeMillis();
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting for rate limit", e);
        }
        long waitedMs = System.currentTimeMillis() - queuedAt;

        log.debug("[GENERATE] Permit granted | callId={} | provider={} | waitedMs={} | estimatedPromptTokens={}",
            callId, providerClient.getProvider().getDisplayName(), waitedMs,
            TokenCounter.countTokens(systemPrompt) + TokenCounter.countTokens(userPrompt));

        long startTime = System.currentTimeMillis();
        String text = providerClient.generateContent(systemPrompt, userPrompt);

        log.debug("[GENERATE] Call completed | callId={} | durationMs={} | responseLength={}",
            callId, System.currentTimeMillis() - startTime, text.length());
        return text;
    }
}
