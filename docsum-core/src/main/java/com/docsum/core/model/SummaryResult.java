package com.docsum.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Final summary of one run plus what it cost.
 */
@Value
@Builder
public class SummaryResult {
    String summary;
    ProcessingMode processingMode;
    int chunkCount;
    int mapCalls;
    /** Hierarchical reduce passes, including the final combine. */
    int reducePasses;
    int generationCalls;
    long durationMs;
}
