package com.modelrouter.model.routing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class ModelBackend {

    @NonNull
    String id;

    @NonNull
    BackendClass backendClass;

    /** Base URL of the model server, e.g. {@code http://localhost:11434}. */
    @NonNull
    String baseUrl;

    /** Model name sent to the server. */
    @NonNull
    String model;

    @NonNull
    BigDecimal costPerRequest;

    @With
    @Builder.Default
    HealthState health = HealthState.CLOSED;

    public boolean isAvailable() {
        return health != HealthState.OPEN;
    }
}
