package com.modelrouter.model.routing;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
public class RoutingDecision {
    String backendId;
    BackendClass backendClass;

    @NonNull
    List<DispatchAttempt> attempts;

    String rationale;

    public RoutingDecision(String backendId, BackendClass backendClass,
                           List<DispatchAttempt> attempts, String rationale) {
        if (attempts == null || attempts.isEmpty()) {
            throw new IllegalArgumentException("A routing decision needs at least one attempt");
        }
        this.backendId = backendId;
        this.backendClass = backendClass;
        this.attempts = List.copyOf(attempts);
        this.rationale = rationale;
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    public boolean isServed() {
        return backendId != null;
    }
}
