package com.clinic.scheduling.exception;

public class InvalidStateException extends SchedulingException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
