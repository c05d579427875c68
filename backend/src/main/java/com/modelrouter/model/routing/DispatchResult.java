package com.modelrouter.model.routing;

import lombok.Value;

@Value
public class DispatchResult {
    RoutingDecision decision;
    ModelBackend backend;
    String text;
}
