package com.docsum.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Gemini {@code generateContent} response body. Only the fields the summarizer reads.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeminiResponse {
    private List<Candidate> candidates;
    private UsageMetadata usageMetadata;
    
    /**
     * First candidate, or {@code null} when the model returned none (e.g. prompt blocked).
     */
    public Candidate firstCandidate() {
        return candidates == null || candidates.isEmpty() ? null : candidates.get(0);
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Candidate {
        private Content content;
        private String finishReason;
        private String finishMessage;
        
        /** Text of the first part, or {@code null} if there is none. */
        public String firstText() {
            if (content == null || content.getParts() == null || content.getParts().isEmpty()) {
                return null;
            }
            return content.getParts().get(0).getText();
        }
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Content {
        private List<Part> parts;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Part {
        private String text;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UsageMetadata {
        private int promptTokenCount;
        private int candidatesTokenCount;
    }
}
