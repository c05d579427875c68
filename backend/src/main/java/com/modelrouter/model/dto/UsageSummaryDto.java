package com.modelrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
public class UsageSummaryDto {
    private Long totalRequests;
    private Long successfulRequests;
    private Long failedRequests;
    private BigDecimal totalRevenue;
    private BigDecimal totalCost;
    private BigDecimal totalMargin;
    private Map<String, Long> requestsByTier;
    private List<BackendUsageDto> backends;
    private Long meteringWriteFailures;
    private Long negativeMarginRecords;
}
