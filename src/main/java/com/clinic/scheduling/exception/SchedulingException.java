package com.clinic.scheduling.exception;

/**
 * Base of every scheduling failure. Unchecked so that a throw inside a transactional
 * service method rolls the whole operation back.
 */
public abstract class SchedulingException extends RuntimeException {

    private final ErrorKind kind;

    protected SchedulingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
