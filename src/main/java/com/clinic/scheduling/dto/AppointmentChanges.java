package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.Appointment;

import java.time.LocalDateTime;

/** Partial update: null members stay as they are. */
public record AppointmentChanges(LocalDateTime appointmentDate, Appointment.Status status) {

    public boolean isEmpty() {
        return appointmentDate == null && status == null;
    }
}
