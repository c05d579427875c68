package com.modelrouter.exception;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {
    INVALID_TIER("InvalidTier", false),
    INVALID_REQUEST("InvalidRequest", false),
    CLASSIFICATION_DEGRADED("ClassificationDegraded", false),
    BACKEND_TIMEOUT("BackendTimeout", true),
    BACKEND_REJECTED("BackendRejected", true),
    ALL_BACKENDS_UNAVAILABLE("AllBackendsUnavailable", true),
    METERING_WRITE_FAILED("MeteringWriteFailed", false),
    INTERNAL_ERROR("InternalError", true);

    private final String code;
    private final boolean retryable;

    ErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
