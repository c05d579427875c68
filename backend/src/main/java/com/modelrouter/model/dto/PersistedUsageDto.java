package com.modelrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
public class PersistedUsageDto {
    private Long successfulRequests;
    private Long failedRequests;
    private Map<String, BigDecimal> marginByTier;
}
