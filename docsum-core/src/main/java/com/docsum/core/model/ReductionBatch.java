package com.docsum.core.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Consecutive summaries {@code [fromIndex, fromIndex + size)} of the pending list that are
 * combined by one request.
 */
@Value
public class ReductionBatch {
    int fromIndex;
    List<String> summaries;
    
    public int getToIndex() {
        return fromIndex + summaries.size();
    }
    
    /**
     * Cuts the ordered list into consecutive batches of at most {@code maxBatchSize}.
     * Batches hold copies, so the source list may be modified afterwards.
     */
    public static List<ReductionBatch> partition(List<String> summaries, int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
        }
        List<ReductionBatch> batches = new ArrayList<>();
        for (int from = 0; from < summaries.size(); from += maxBatchSize) {
            int to = Math.min(from + maxBatchSize, summaries.size());
            batches.add(new ReductionBatch(from, List.copyOf(summaries.subList(from, to))));
        }
        return batches;
    }
}
