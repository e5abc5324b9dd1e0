package com.docsum.api.controller;

import com.docsum.api.dto.request.SummarizeRequest;
import com.docsum.api.dto.response.SummaryResponse;
import com.docsum.api.exception.SummaryTimeoutException;
import com.docsum.core.config.SummarizerProperties;
import com.docsum.core.model.SummaryResult;
import com.docsum.core.summary.MapReduceOrchestrator;
import com.docsum.llm.exception.GenerationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api/v1/summaries")
@RequiredArgsConstructor
@Slf4j
public class SummaryController {
    
    private final MapReduceOrchestrator orchestrator;
    private final SummarizerProperties summarizerProperties;
    
    @PostMapping
    public ResponseEntity<SummaryResponse> summarize(@Valid @RequestBody SummarizeRequest request) throws InterruptedException {
        log.info("Summary request | characters={}", request.getText().length());
        
        SummaryResult result = await(orchestrator.summarizeWithReport(request.getText()));
        return ResponseEntity.ok(SummaryResponse.from(result));
    }
    
    private SummaryResult await(CompletableFuture<SummaryResult> run) throws InterruptedException {
        long timeoutSeconds = summarizerProperties.getRequestTimeoutSeconds();
        try {
            return run.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            run.cancel(true);
            throw new SummaryTimeoutException(timeoutSeconds);
        } catch (InterruptedException e) {
            run.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new GenerationException("Summarization failed: " + cause.getMessage(), cause);
        }
    }
}
