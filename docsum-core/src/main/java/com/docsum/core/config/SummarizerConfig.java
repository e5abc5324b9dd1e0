package com.docsum.core.config;

import com.docsum.common.concurrent.NamedThreadFactory;
import com.docsum.core.chunking.RecursiveTextChunker;
import com.docsum.core.summary.MapReduceOrchestrator;
import com.docsum.llm.generation.Generator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Orchestrating tasks get their own pool. They block while their generation calls run, so
 * sharing the generation pool could leave no thread to run those calls.
 */
@Configuration
@Slf4j
public class SummarizerConfig {

    @Bean(name = "summaryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService summaryExecutor(SummarizerProperties properties) {
        properties.validate();
        return Executors.newFixedThreadPool(properties.getOrchestratorThreads(), new NamedThreadFactory("summary-run-"));
    }

    @Bean
    public MapReduceOrchestrator mapReduceOrchestrator(
            RecursiveTextChunker chunker,
            Generator generator,
            SummarizerProperties properties,
            @Qualifier("summaryExecutor") ExecutorService summaryExecutor) {
        log.info("[MAP_REDUCE] Orchestrator ready | chunkSize={} | overlap={} | maxBatchSize={} | orchestratorThreads={}",
            properties.getChunkSize(), properties.getChunkOverlap(), properties.getMaxBatchSize(),
            properties.getOrchestratorThreads());
        return new MapReduceOrchestrator(chunker, generator, properties, summaryExecutor);
    }
}
