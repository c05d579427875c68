package com.modelrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class BackendUsageDto {
    private String backendId;
    private Long requestCount;
    /** Fraction of successful requests served by this backend. */
    private Double share;
    private Double avgLatencyMs;
}
