package com.clinic.scheduling.exception;

public class UnauthenticatedException extends SchedulingException {

    public UnauthenticatedException(String message) {
        super(ErrorKind.UNAUTHENTICATED, message);
    }
}
