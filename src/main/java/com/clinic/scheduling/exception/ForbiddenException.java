package com.clinic.scheduling.exception;

public class ForbiddenException extends SchedulingException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
