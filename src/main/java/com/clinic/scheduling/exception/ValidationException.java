package com.clinic.scheduling.exception;

/** Malformed input such as inverted time ranges or a non-positive duration. */
public class ValidationException extends SchedulingException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
