package com.modelrouter.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class BackendTimeoutException extends RoutingException {

    private final String backendId;

    public BackendTimeoutException(String backendId, Duration timeout) {
        super(ErrorKind.BACKEND_TIMEOUT, "Backend " + backendId + " timed out after " + timeout.toMillis() + "ms");
        this.backendId = backendId;
    }
}
