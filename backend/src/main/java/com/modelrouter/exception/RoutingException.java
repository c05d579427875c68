package com.modelrouter.exception;

import lombok.Getter;

@Getter
public class RoutingException extends RuntimeException {

    private final ErrorKind kind;

    public RoutingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RoutingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
