package com.modelrouter.model.routing;

import lombok.Value;

import java.util.Map;

@Value
public class ComplexityScore {

    public static final double MIN = 0.0;
    public static final double MAX = 1.0;

    double value;
    Map<String, Double> breakdown;

    /** Set when the input could not be classified and the minimum score was used instead. */
    boolean degraded;

    public static ComplexityScore minimum() {
        return new ComplexityScore(MIN, Map.of(), true);
    }
}
