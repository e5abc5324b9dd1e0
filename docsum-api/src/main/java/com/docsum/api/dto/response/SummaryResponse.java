package com.docsum.api.dto.response;

import com.docsum.core.model.SummaryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResponse {
    private String summary;
    private String processingMode;
    private int chunkCount;
    private int generationCalls;
    private int reducePasses;
    private long durationMs;
    
    public static SummaryResponse from(SummaryResult result) {
        return SummaryResponse.builder()
            .summary(result.getSummary())
            .processingMode(result.getProcessingMode().getLabel())
            .chunkCount(result.getChunkCount())
            .generationCalls(result.getGenerationCalls())
            .reducePasses(result.getReducePasses())
            .durationMs(result.getDurationMs())
            .build();
    }
}
