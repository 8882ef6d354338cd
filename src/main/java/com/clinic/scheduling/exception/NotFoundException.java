package com.clinic.scheduling.exception;

public class NotFoundException extends SchedulingException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException slot(Long slotId) {
        return new NotFoundException("Slot " + slotId + " not found.");
    }

    public static NotFoundException appointment(Long appointmentId) {
        return new NotFoundException("Appointment " + appointmentId + " not found.");
    }

    public static NotFoundException doctor(Long doctorId) {
        return new NotFoundException("Doctor " + doctorId + " not found.");
    }
}
