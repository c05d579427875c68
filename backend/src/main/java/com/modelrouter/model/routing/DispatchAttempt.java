package com.modelrouter.model.routing;

import lombok.Value;

@Value
public class DispatchAttempt {
    int sequence;
    BackendClass backendClass;

    /** Null when the whole class was skipped. */
    String backendId;

    AttemptOutcome outcome;
    long latencyMs;
    String detail;
}
