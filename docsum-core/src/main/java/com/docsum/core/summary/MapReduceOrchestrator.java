package com.docsum.core.summary;

import com.docsum.common.concurrent.CancellableFutures;
import com.docsum.common.util.TokenCounter;
import com.docsum.core.chunking.RecursiveTextChunker;
import com.docsum.core.config.SummarizerProperties;
import com.docsum.core.model.ProcessingMode;
import com.docsum.core.model.ReductionBatch;
import com.docsum.core.model.SummaryResult;
import com.docsum.core.model.TextChunk;
import com.docsum.llm.exception.GenerationException;
import com.docsum.llm.generation.Generator;
import com.docsum.llm.prompt.SummaryPrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Summarizes arbitrarily long text with a Map-Reduce pipeline.
 *
 * <ol>
 *   <li>Chunk the text. A single chunk is summarized directly.</li>
 *   <li>MAP: summarize every chunk in parallel.</li>
 *   <li>REDUCE: while more than {@code maxBatchSize} summaries remain, combine consecutive
 *       batches in parallel, each batch collapsing to one entry in place.</li>
 *   <li>FINAL: one combine call over the remaining summaries.</li>
 * </ol>
 *
 * Every request goes through the injected {@link Generator}, which applies the shared rate
 * limit. Any failed request fails the whole run; no partial summary is returned.
 */
@RequiredArgsConstructor
@Slf4j
public class MapReduceOrchestrator {
    
    public static final String NO_CONTENT_SUMMARY = "No content to summarize.";
    
    private final RecursiveTextChunker chunker;
    private final Generator generator;
    private final SummarizerProperties properties;
    private final ExecutorService executor;
    
    private final AtomicLong runSequence = new AtomicLong();
    
    /**
     * Final Markdown summary of {@code text}. Cancelling the returned future abandons every
     * outstanding request of the run.
     */
    public CompletableFuture<String> summarize(String text) {
        CompletableFuture<SummaryResult> run = summarizeWithReport(text);
        CompletableFuture<String> summary = run.thenApply(SummaryResult::getSummary);
        summary.whenComplete((value, error) -> {
            if (summary.isCancelled()) {
                run.cancel(true);
            }
        });
        return summary;
    }
    
    public CompletableFuture<SummaryResult> summarizeWithReport(String text) {
        if (text == null || text.isBlank()) {
            log.info("[MAP_REDUCE] Empty input, nothing to summarize");
            return CompletableFuture.completedFuture(SummaryResult.builder()
                .summary(NO_CONTENT_SUMMARY)
                .processingMode(ProcessingMode.EMPTY)
                .build());
        }
        
        String runId = "run-" + runSequence.incrementAndGet();
        return CancellableFutures.submit(executor, () -> execute(runId, text));
    }
    
    private SummaryResult execute(String runId, String text) throws InterruptedException {
        long startTime = System.currentTimeMillis();
        try {
            SummaryResult result = runPipeline(runId, text, startTime);
            log.info("[MAP_REDUCE] Run completed | runId={} | mode={} | chunks={} | generationCalls={} | reducePasses={} | durationMs={} | summaryLength={}",
                runId, result.getProcessingMode().getLabel(), result.getChunkCount(), result.getGenerationCalls(),
                result.getReducePasses(), result.getDurationMs(), result.getSummary().length());
            return result;
        } catch (GenerationException e) {
            log.error("[MAP_REDUCE] Run failed | runId={} | durationMs={} | provider={} | statusCode={} | error={}",
                runId, System.currentTimeMillis() - startTime,
                e.getProvider() != null ? e.getProvider().getDisplayName() : "n/a", e.getStatusCode(), e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            log.warn("[MAP_REDUCE] Run cancelled | runId={} | durationMs={}", runId, System.currentTimeMillis() - startTime);
            throw e;
        }
    }
    
    private SummaryResult runPipeline(String runId, String text, long startTime) throws InterruptedException {
        int maxBatchSize = properties.getMaxBatchSize();
        
        // ============================================
        // PHASE 1: CHUNK
        // ============================================
        List<TextChunk> chunks = chunker.split(text, properties.getChunkSize(), properties.getChunkOverlap());
        log.info("[MAP_REDUCE] Document split | runId={} | characters={} | chunks={} | chunkSize={} | overlap={}",
            runId, text.length(), chunks.size(), properties.getChunkSize(), properties.getChunkOverlap());
        
        if (chunks.isEmpty()) {
            return SummaryResult.builder()
                .summary(NO_CONTENT_SUMMARY)
                .processingMode(ProcessingMode.EMPTY)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
        }

        if (chunks.size() == 1) {
            log.info("[MAP_REDUCE] Single chunk, direct summarization | runId={}", runId);
            String summary = OrderedFanOut.awaitAll(List.of(mapCall(chunks.get(0)))).get(0);
            return SummaryResult.builder()
                .summary(summary)
                .processingMode(ProcessingMode.SINGLE_PASS)
                .chunkCount(1)
                .mapCalls(1)
                .generationCalls(1)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
        }
        
        // ============================================
        // PHASE 2: MAP - parallel chunk summaries
        // ============================================
        log.info("[MAP_REDUCE] Map phase | runId={} | parallelCalls={}", runId, chunks.size());
        List<CompletableFuture<String>> mapCalls = chunks.stream()
            .map(this::mapCall)
            .toList();
        List<String> pending = new ArrayList<>(OrderedFanOut.awaitAll(mapCalls));
        int generationCalls = chunks.size();
        int reducePasses = 0;
        
        // ============================================
        // PHASE 3: REDUCE - hierarchical batches
        // ============================================
        while (pending.size() > maxBatchSize) {
            List<ReductionBatch> batches = ReductionBatch.partition(pending, maxBatchSize);
            log.info("[MAP_REDUCE] Reduce pass | runId={} | pass={} | summaries={} | batches={} | estimatedTokens={}",
                runId, reducePasses + 1, pending.size(), batches.size(), TokenCounter.countTokens(pending));
            
            List<CompletableFuture<String>> combineCalls = batches.stream()
                .map(batch -> combineCall(batch.getSummaries()))
                .toList();
            List<String> combined = OrderedFanOut.awaitAll(combineCalls);
            
            // Back to front, so earlier ranges keep their indexes
            for (int i = batches.size() - 1; i >= 0; i--) {
                ReductionBatch batch = batches.get(i);
                pending.subList(batch.getFromIndex(), batch.getToIndex()).clear();
                pending.add(batch.getFromIndex(), combined.get(i));
            }
            generationCalls += batches.size();
            reducePasses++;
        }
        
        // ============================================
        // PHASE 4: FINAL COMBINE
        // ============================================
        log.info("[MAP_REDUCE] Final combine | runId={} | summaries={}", runId, pending.size());
        String finalSummary = OrderedFanOut.awaitAll(List.of(combineCall(pending))).get(0);
        
        return SummaryResult.builder()
            .summary(finalSummary)
            .processingMode(ProcessingMode.MAP_REDUCE)
            .chunkCount(chunks.size())
            .mapCalls(chunks.size())
            .reducePasses(reducePasses + 1)
            .generationCalls(generationCalls + 1)
            .durationMs(System.currentTimeMillis() - startTime)
            .build();
    }
    
    private CompletableFuture<String> mapCall(TextChunk chunk) {
        return generator.generate(SummaryPrompts.MAP_SYSTEM, SummaryPrompts.summarizeSection(chunk.getContent()));
    }
    
    private CompletableFuture<String> combineCall(List<String> summaries) {
        return generator.generate(SummaryPrompts.REDUCE_SYSTEM, SummaryPrompts.combineSummaries(summaries));
    }
}
