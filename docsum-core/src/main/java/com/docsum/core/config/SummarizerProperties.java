package com.docsum.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "docsum.summarizer")
@Getter
@Setter
public class SummarizerProperties {
    private int chunkSize = 4000; // characters, ~1000 tokens
    private int chunkOverlap = 200;
    private int maxBatchSize = 10; // summaries per combine request
    private int orchestratorThreads = 4; // concurrent runs
    private int requestTimeoutSeconds = 600;
    
    public void validate() {
        if (chunkSize <= 0) {
            throw new IllegalStateException("docsum.summarizer.chunk-size must be positive: " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalStateException(
                "docsum.summarizer.chunk-overlap must be in [0, chunk-size): " + chunkOverlap);
        }
        // A batch of one never shrinks the pending list
        if (maxBatchSize < 2) {
            throw new IllegalStateException("docsum.summarizer.max-batch-size must be at least 2: " + maxBatchSize);
        }
        if (orchestratorThreads <= 0) {
            throw new IllegalStateException("docsum.summarizer.orchestrator-threads must be positive");
        }
    }
}
