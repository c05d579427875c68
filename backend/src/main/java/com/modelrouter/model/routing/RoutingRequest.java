package com.modelrouter.model.routing;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RoutingRequest {
    String id;
    String prompt;
    Tier tier;
    Instant arrivedAt;
    Double complexityHint;
}
