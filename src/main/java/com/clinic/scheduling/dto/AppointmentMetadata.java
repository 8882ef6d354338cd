package com.clinic.scheduling.dto;

import com.clinic.scheduling.entity.Appointment;
import com.clinic.scheduling.entity.DeliveryMode;

/**
 * Descriptive fields of a new appointment. Null members fall back to defaults:
 * NORMAL urgency, "general" visit type, the slot's delivery mode and CONFIRMED status.
 */
public record AppointmentMetadata(
        Long institutionId,
        Long specialtyId,
        Appointment.Urgency urgency,
        String visitType,
        DeliveryMode deliveryMode,
        Appointment.Status status
) {
    public static AppointmentMetadata defaults() {
        return new AppointmentMetadata(null, null, null, null, null, null);
    }
}
