package com.modelrouter.model.routing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class UsageRecord {
    String requestId;
    Tier tier;
    String backendId;
    long latencyMs;
    BigDecimal cost;
    BigDecimal price;
    BigDecimal margin;
    int attempts;
    boolean success;
    Instant recordedAt;
}
