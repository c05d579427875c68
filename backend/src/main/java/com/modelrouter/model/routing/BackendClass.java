package com.modelrouter.model.routing;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BackendClass {
    /** Fast, cheap models. */
    LIGHTWEIGHT("lightweight"),
    /** Slower, higher-quality models. */
    HEAVYWEIGHT("heavyweight");

    private final String code;

    BackendClass(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
