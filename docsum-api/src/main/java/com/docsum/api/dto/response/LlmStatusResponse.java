package com.docsum.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmStatusResponse {
    private String provider;
    private String model;
    private int requestsPerMinute;
    private double burstCapacity;
    private double availableTokens;
}
