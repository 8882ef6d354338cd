package com.clinic.scheduling.exception;

/** A schedule change would overlap another live slot of the same doctor. */
public class SlotConflictException extends SchedulingException {

    public SlotConflictException(String message) {
        super(ErrorKind.SLOT_CONFLICT, message);
    }
}
