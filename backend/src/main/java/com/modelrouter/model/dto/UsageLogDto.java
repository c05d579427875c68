package com.modelrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder
@AllArgsConstructor
public class UsageLogDto {
    private String requestId;
    private String tier;
    private String backendId;
    private Long latencyMs;
    private BigDecimal cost;
    private BigDecimal price;
    private BigDecimal margin;
    private Integer attempts;
    private String status;
    private OffsetDateTime createdAt;
}
