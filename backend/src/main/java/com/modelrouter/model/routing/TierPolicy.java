package com.modelrouter.model.routing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class TierPolicy {

    @NonNull
    Tier tier;

    double threshold;

    @NonNull
    List<BackendClass> belowThreshold;

    @NonNull
    List<BackendClass> atOrAboveThreshold;

    /** Price charged per successful request. */
    @NonNull
    BigDecimal price;

    public List<BackendClass> classesFor(double score) {
        return score >= threshold ? atOrAboveThreshold : belowThreshold;
    }
}
