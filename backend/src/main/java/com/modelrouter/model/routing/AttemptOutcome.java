package com.modelrouter.model.routing;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttemptOutcome {
    SUCCESS("success"),
    TIMEOUT("timeout"),
    REJECTED("rejected"),
    /** Nothing was called: the class had no usable backend or the breaker refused the call. */
    UNAVAILABLE("unavailable");

    private final String code;

    AttemptOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
