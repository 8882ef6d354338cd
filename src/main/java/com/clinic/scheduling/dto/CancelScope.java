package com.clinic.scheduling.dto;

/**
 * Which doctors a bulk cancellation touches. A null doctor id means all of them.
 */
public record CancelScope(Long doctorId) {

    public static CancelScope doctor(Long doctorId) {
        return new CancelScope(doctorId);
    }

    public static CancelScope allDoctors() {
        return new CancelScope(null);
    }

    public boolean coversAllDoctors() {
        return doctorId == null;
    }
}
