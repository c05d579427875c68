package com.modelrouter.model.routing;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthState {
    CLOSED("closed"),
    OPEN("open"),
    HALF_OPEN("half-open");

    private final String code;

    HealthState(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
