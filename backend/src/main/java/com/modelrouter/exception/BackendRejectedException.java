package com.modelrouter.exception;

import lombok.Getter;

@Getter
public class BackendRejectedException extends RoutingException {

    private final String backendId;

    /** HTTP status returned by the backend, or 0 when the call never got a response. */
    private final int statusCode;

    public BackendRejectedException(String backendId, int statusCode, String message) {
        super(ErrorKind.BACKEND_REJECTED, "Backend " + backendId + " failed: " + message);
        this.backendId = backendId;
        this.statusCode = statusCode;
    }

    public BackendRejectedException(String backendId, Throwable cause) {
        super(ErrorKind.BACKEND_REJECTED, "Backend " + backendId + " failed: " + cause.getMessage(), cause);
        this.backendId = backendId;
        this.statusCode = 0;
    }
}
