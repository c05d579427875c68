package com.modelrouter.exception;

public class InvalidRequestException extends RoutingException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
