package com.docsum.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SummarizeRequest {
    
    // Blank text is accepted and yields the "no content" summary
    @NotNull(message = "Text is required")
    private String text;
}
